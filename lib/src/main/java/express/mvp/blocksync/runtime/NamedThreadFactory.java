package express.mvp.blocksync.runtime;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory producing daemon platform threads named {@code {prefix}-{counter}}.
 *
 * <p>Uncaught exceptions are logged instead of printed to standard error.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe.
 *
 * @see WorkerPool
 */
public final class NamedThreadFactory implements ThreadFactory {

    private static final Logger LOGGER = Logger.getLogger(NamedThreadFactory.class.getName());

    /** Counter for generating unique thread names. */
    private final AtomicLong threadCount = new AtomicLong(0);

    private final String namePrefix;

    /**
     * Creates a factory.
     *
     * @param namePrefix the prefix for thread names
     */
    public NamedThreadFactory(String namePrefix) {
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, namePrefix + "-" + threadCount.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(
                (t, e) -> LOGGER.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
        return thread;
    }

    /**
     * Returns the number of threads created by this factory.
     *
     * @return the total count of threads created
     */
    public long getThreadCount() {
        return threadCount.get();
    }

    @Override
    public String toString() {
        return "NamedThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
