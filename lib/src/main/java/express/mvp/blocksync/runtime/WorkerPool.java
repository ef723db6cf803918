package express.mvp.blocksync.runtime;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker pool for blocking remote calls.
 *
 * <p>Fetches and saves block their worker thread for the duration of the HTTP exchange. A session
 * has at most one fetch and one save outstanding, so a small cached pool of platform threads is
 * enough; idle threads expire after a minute.
 *
 * <pre>{@code
 * WorkerPool workers = WorkerPool.builder().namePrefix("blocksync-io").build();
 * workers.execute(() -> post(fetch(blockId)));
 * workers.shutdown(Duration.ofSeconds(5));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Tasks can be submitted from any thread concurrently.
 */
public final class WorkerPool implements AutoCloseable {

    private final ExecutorService executor;

    private final NamedThreadFactory threadFactory;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final AtomicLong submittedTasks = new AtomicLong(0);

    private final AtomicLong completedTasks = new AtomicLong(0);

    /** Counter for failed tasks (threw exception). */
    private final AtomicLong failedTasks = new AtomicLong(0);

    /** Counter for rejected tasks (submitted after shutdown). */
    private final AtomicLong rejectedTasks = new AtomicLong(0);

    private WorkerPool(NamedThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        this.executor = Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * Creates a builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a worker pool with the given name prefix.
     *
     * @param namePrefix the prefix for worker thread names
     * @return a new worker pool
     */
    public static WorkerPool create(String namePrefix) {
        return builder().namePrefix(namePrefix).build();
    }

    /**
     * Runs a task on a worker thread.
     *
     * @param task the task to execute
     * @return false if the pool is shut down and the task was dropped
     */
    public boolean execute(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        if (shutdown.get()) {
            rejectedTasks.incrementAndGet();
            return false;
        }
        submittedTasks.incrementAndGet();
        try {
            executor.execute(
                    () -> {
                        try {
                            task.run();
                            completedTasks.incrementAndGet();
                        } catch (RuntimeException | Error t) {
                            failedTasks.incrementAndGet();
                            throw t;
                        }
                    });
            return true;
        } catch (RejectedExecutionException e) {
            submittedTasks.decrementAndGet();
            rejectedTasks.incrementAndGet();
            return false;
        }
    }

    /**
     * Stops accepting tasks and waits for running ones.
     *
     * <p>Invocation has no additional effect if already shut down.
     *
     * @param timeout maximum time to wait for tasks to complete
     * @return true if all tasks completed before timeout, false otherwise
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        if (!shutdown.compareAndSet(false, true)) {
            return executor.isTerminated();
        }
        executor.shutdown();
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Interrupts running tasks and drops queued ones. */
    public void shutdownNow() {
        shutdown.set(true);
        executor.shutdownNow();
    }

    /**
     * Returns whether the pool stopped accepting tasks.
     *
     * @return true after {@link #shutdown(Duration)} or {@link #shutdownNow()}
     */
    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Returns a snapshot of the task counters.
     *
     * @return current statistics
     */
    public Stats getStats() {
        return new Stats(
                submittedTasks.get(),
                completedTasks.get(),
                failedTasks.get(),
                rejectedTasks.get(),
                threadFactory.getThreadCount());
    }

    @Override
    public void close() {
        shutdownNow();
    }

    @Override
    public String toString() {
        return "WorkerPool[" + getStats() + ", shutdown=" + shutdown.get() + "]";
    }

    /** Builder for {@link WorkerPool}. */
    public static final class Builder {

        private String namePrefix = "blocksync-worker";

        private Builder() {}

        /**
         * Sets the worker thread name prefix.
         *
         * @param namePrefix the prefix, default {@code blocksync-worker}
         * @return this builder
         */
        public Builder namePrefix(String namePrefix) {
            this.namePrefix = Objects.requireNonNull(namePrefix);
            return this;
        }

        /**
         * Builds the pool. Its threads are daemon threads.
         *
         * @return a new worker pool
         */
        public WorkerPool build() {
            return new WorkerPool(new NamedThreadFactory(namePrefix));
        }
    }

    /**
     * Immutable snapshot of worker pool statistics.
     *
     * @param submitted number of tasks submitted
     * @param completed number of tasks completed successfully
     * @param failed number of tasks that threw exceptions
     * @param rejected number of tasks rejected after shutdown
     * @param threads number of threads created
     */
    public record Stats(long submitted, long completed, long failed, long rejected, long threads) {

        /**
         * Returns the tasks submitted but not yet finished.
         *
         * @return running task count
         */
        public long active() {
            return submitted - completed - failed;
        }

        @Override
        public String toString() {
            return String.format(
                    "Stats[submitted=%d, completed=%d, failed=%d, rejected=%d, threads=%d]",
                    submitted, completed, failed, rejected, threads);
        }
    }
}
