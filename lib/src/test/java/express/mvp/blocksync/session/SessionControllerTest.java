package express.mvp.blocksync.session;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.blocksync.block.BlockContent;
import express.mvp.blocksync.block.BlockType;
import express.mvp.blocksync.block.BlockUpdate;
import express.mvp.blocksync.error.ErrorCategory;
import express.mvp.blocksync.store.RemoteStoreException;
import express.mvp.blocksync.store.SaveReceipt;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Unit tests for {@link SessionController}, driven synchronously message by message. */
@DisplayName("SessionController")
class SessionControllerTest {

    private static final Instant LOADED_AT = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant SAVED_AT = Instant.parse("2024-05-01T10:05:00Z");

    private SessionController controller;

    @BeforeEach
    void setUp() {
        controller = new SessionController();
    }

    // ========== Helpers ==========

    private static BlockContent content(String blockId, BlockType type, String text) {
        return new BlockContent(blockId, "p1", type, text, LOADED_AT);
    }

    private static RuntimeException transientFailure() {
        return new RemoteStoreException(503, "service_unavailable", "Service unavailable");
    }

    private static RuntimeException permanentFailure() {
        return new RemoteStoreException(400, "validation_error", "body failed validation");
    }

    private static <T extends SessionCommand> T only(List<SessionCommand> commands, Class<T> type) {
        List<T> matches = new ArrayList<>();
        for (SessionCommand command : commands) {
            if (type.isInstance(command)) {
                matches.add(type.cast(command));
            }
        }
        assertEquals(1, matches.size(), "expected one " + type.getSimpleName() + " in " + commands);
        return matches.get(0);
    }

    private static boolean contains(List<SessionCommand> commands, Class<?> type) {
        return commands.stream().anyMatch(type::isInstance);
    }

    private List<SessionCommand> send(SessionMessage message) {
        return controller.handle(message);
    }

    /** Loads a block and completes its fetch. */
    private void loaded(String blockId, BlockType type, String text) {
        SessionCommand.Fetch fetch = only(send(new SessionMessage.LoadBlock(blockId)), SessionCommand.Fetch.class);
        send(new SessionMessage.FetchSucceeded(fetch.generation(), content(blockId, type, text)));
        assertEquals(SessionPhase.EDITING, controller.phase());
    }

    private SessionCommand.Save requestSave() {
        return only(send(new SessionMessage.SaveRequested()), SessionCommand.Save.class);
    }

    private List<SessionCommand> saveSucceeded(SessionCommand.Save save) {
        return send(new SessionMessage.SaveSucceeded(save.generation(), new SaveReceipt(save.blockId(), SAVED_AT)));
    }

    private List<SessionCommand> saveFailed(SessionCommand.Save save, Throwable failure) {
        return send(new SessionMessage.SaveFailed(save.generation(), failure));
    }

    // ========== Tests ==========

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("LoadBlock enters LOADING and issues a fetch for the new generation")
        void loadBlock_issuesFetch() {
            List<SessionCommand> commands = send(new SessionMessage.LoadBlock("b1", "p1"));

            SessionCommand.Fetch fetch = only(commands, SessionCommand.Fetch.class);
            assertEquals("b1", fetch.blockId());
            assertEquals(1, fetch.generation());
            assertEquals(SessionPhase.LOADING, controller.phase());
            assertNull(controller.draft());
        }

        @Test
        @DisplayName("Successful fetch seeds baseline, type and a clean draft")
        void fetchSucceeded_seedsSession() {
            loaded("b1", BlockType.HEADING_1, "Title");

            SessionState state = controller.state();
            assertEquals(BlockType.HEADING_1, state.blockType());
            assertFalse(state.dirty());
            assertEquals("Title", controller.baselineText());
            assertEquals("Title", controller.draft().getText());
            assertEquals("p1", controller.pageId());
            assertEquals(LOADED_AT, controller.lastEditedTime());
        }

        @Test
        @DisplayName("Failed fetch shows the error and creates no draft")
        void fetchFailed_showsError() {
            SessionCommand.Fetch fetch = only(send(new SessionMessage.LoadBlock("b1")), SessionCommand.Fetch.class);

            List<SessionCommand> commands =
                    send(new SessionMessage.FetchFailed(fetch.generation(), new RemoteStoreException(404, "object_not_found", "gone")));

            ErrorReport report = only(commands, SessionCommand.ShowError.class).report();
            assertEquals(ErrorOrigin.LOAD, report.origin());
            assertEquals(ErrorCategory.NOT_FOUND, report.category());
            assertFalse(report.retryOffered());
            assertEquals(SessionPhase.SHOWING_ERROR, controller.phase());
            assertNull(controller.draft());
        }

        @Test
        @DisplayName("A slow fetch from a superseded load is discarded")
        void staleFetch_isDiscarded() {
            SessionCommand.Fetch first = only(send(new SessionMessage.LoadBlock("b1")), SessionCommand.Fetch.class);
            SessionCommand.Fetch second = only(send(new SessionMessage.LoadBlock("b2")), SessionCommand.Fetch.class);
            assertTrue(second.generation() > first.generation());

            send(new SessionMessage.FetchSucceeded(second.generation(), content("b2", BlockType.PARAGRAPH, "new")));
            List<SessionCommand> late =
                    send(new SessionMessage.FetchSucceeded(first.generation(), content("b1", BlockType.QUOTE, "old")));

            assertTrue(late.isEmpty());
            assertEquals("new", controller.baselineText());
            assertEquals(BlockType.PARAGRAPH, controller.state().blockType());
            assertEquals("b2", controller.state().blockId());
        }

        @Test
        @DisplayName("A late fetch failure from a superseded load is discarded")
        void staleFetchFailure_isDiscarded() {
            SessionCommand.Fetch first = only(send(new SessionMessage.LoadBlock("b1")), SessionCommand.Fetch.class);
            loaded("b2", BlockType.PARAGRAPH, "text");

            List<SessionCommand> late = send(new SessionMessage.FetchFailed(first.generation(), transientFailure()));

            assertTrue(late.isEmpty());
            assertEquals(SessionPhase.EDITING, controller.phase());
        }

        @Test
        @DisplayName("LoadBlock is ignored while a save is in flight")
        void loadBlock_ignoredWhileSaving() {
            loaded("b1", BlockType.PARAGRAPH, "Hello");
            requestSave();

            assertTrue(send(new SessionMessage.LoadBlock("b2")).isEmpty());
            assertEquals(SessionPhase.SAVING, controller.phase());
            assertEquals("b1", controller.state().blockId());
        }

        @Test
        @DisplayName("Loading another block resets every session counter")
        void loadBlock_resetsSession() {
            loaded("b1", BlockType.PARAGRAPH, "Hello");
            send(new SessionMessage.UserEdit("changed"));
            SessionCommand.Save save =
                    only(
                            send(new SessionMessage.TransformRequested(BlockType.QUOTE)),
                            SessionCommand.Save.class);
            saveFailed(save, transientFailure());
            assertEquals(SessionPhase.RETRY_WAITING, controller.phase());

            send(new SessionMessage.LoadBlock("b2"));

            SessionState state = controller.state();
            assertEquals(SessionPhase.LOADING, state.phase());
            assertEquals("b2", state.blockId());
            assertNull(state.pendingBlockType());
            assertNull(state.blockType());
            assertEquals(0, state.retryAttempt());
            assertFalse(state.dirty());
            assertNull(controller.draft());
            assertTrue(send(new SessionMessage.RetryTimerFired(save.generation())).isEmpty());
        }
    }

    @Nested
    @DisplayName("Editing")
    class EditingTests {

        @BeforeEach
        void load() {
            loaded("b1", BlockType.PARAGRAPH, "Hello");
        }

        @Test
        @DisplayName("An edit that differs from the baseline makes the session dirty")
        void edit_makesDirty() {
            assertTrue(send(new SessionMessage.UserEdit("Hello World")).isEmpty());
            assertTrue(controller.state().dirty());
        }

        @Test
        @DisplayName("Editing back to the baseline makes it clean again")
        void editBack_isClean() {
            send(new SessionMessage.UserEdit("Hello World"));
            send(new SessionMessage.UserEdit("Hello"));
            assertFalse(controller.state().dirty());
        }

        @Test
        @DisplayName("Edits are ignored while saving")
        void edit_ignoredWhileSaving() {
            send(new SessionMessage.UserEdit("Hello World"));
            requestSave();

            send(new SessionMessage.UserEdit("sneaky"));

            assertEquals("Hello World", controller.draft().getText());
        }

        @Test
        @DisplayName("Navigation keys are forwarded in any phase")
        void navigation_isForwarded() {
            requestSave();
            List<SessionCommand> commands =
                    send(new SessionMessage.NavigationRequested(NavigationSignal.NAVIGATE_BACK));
            assertEquals(NavigationSignal.NAVIGATE_BACK, only(commands, SessionCommand.Navigate.class).signal());
            assertEquals(SessionPhase.SAVING, controller.phase());
        }
    }

    @Nested
    @DisplayName("Saving")
    class SavingTests {

        @BeforeEach
        void load() {
            loaded("b1", BlockType.PARAGRAPH, "Hello");
        }

        @Test
        @DisplayName("Hello -> Hello World saves and ends clean with the new baseline")
        void helloWorldScenario() {
            send(new SessionMessage.UserEdit("Hello World"));
            assertTrue(controller.state().dirty());

            SessionCommand.Save save = requestSave();
            assertEquals(SessionPhase.SAVING, controller.phase());
            assertEquals("b1", save.blockId());
            assertEquals(BlockType.PARAGRAPH, save.update().type());
            assertEquals("Hello World", save.update().text());

            saveSucceeded(save);

            assertEquals(SessionPhase.EDITING, controller.phase());
            assertFalse(controller.state().dirty());
            assertEquals("Hello World", controller.baselineText());
            assertFalse(controller.draft().isDirty());
            assertEquals(SAVED_AT, controller.lastEditedTime());
        }

        @Test
        @DisplayName("markClean after a successful save is a no-op the second time")
        void markClean_isIdempotent() {
            send(new SessionMessage.UserEdit("Hello World"));
            saveSucceeded(requestSave());

            controller.draft().markClean();
            assertFalse(controller.draft().isDirty());
            assertEquals(controller.baselineText(), controller.draft().getText());
            controller.draft().markClean();
            assertFalse(controller.draft().isDirty());
            assertEquals("Hello World", controller.baselineText());
        }

        @ParameterizedTest(name = "maxRetries = {0}")
        @ValueSource(ints = {0, 1, 3, 5})
        @DisplayName("A save that always fails transiently is attempted N + 1 times with doubling delays")
        void alwaysTransient_attemptsNPlusOne(int maxRetries) {
            controller = new SessionController(SessionConfig.builder().maxRetries(maxRetries).build());
            loaded("b1", BlockType.PARAGRAPH, "Hello");
            send(new SessionMessage.UserEdit("Hello World"));

            List<BlockUpdate> attempts = new ArrayList<>();
            List<Duration> delays = new ArrayList<>();
            SessionCommand.Save save = requestSave();
            ErrorReport report = null;
            while (report == null) {
                attempts.add(save.update());
                List<SessionCommand> commands = saveFailed(save, transientFailure());
                if (contains(commands, SessionCommand.ShowError.class)) {
                    report = only(commands, SessionCommand.ShowError.class).report();
                } else {
                    SessionCommand.ScheduleRetry retry = only(commands, SessionCommand.ScheduleRetry.class);
                    delays.add(retry.delay());
                    assertEquals(SessionPhase.RETRY_WAITING, controller.phase());
                    assertEquals(delays.size(), controller.state().retryAttempt());
                    save = only(
                            send(new SessionMessage.RetryTimerFired(retry.generation())),
                            SessionCommand.Save.class);
                }
            }

            assertEquals(maxRetries + 1, attempts.size());
            for (int k = 0; k < delays.size(); k++) {
                long expectedSeconds = Math.min(1L << k, 10L);
                assertEquals(Duration.ofSeconds(expectedSeconds), delays.get(k));
            }
            for (BlockUpdate attempt : attempts) {
                assertEquals(attempts.get(0), attempt);
            }
            assertEquals(SessionPhase.SHOWING_ERROR, controller.phase());
            assertTrue(report.retryOffered());
            assertEquals(ErrorOrigin.SAVE, report.origin());
            assertTrue(controller.state().retryAttempt() <= maxRetries);
        }

        @Test
        @DisplayName("A permanent failure shows the error at once without offering retry")
        void permanentFailure_noRetry() {
            send(new SessionMessage.UserEdit("Hello World"));

            List<SessionCommand> commands = saveFailed(requestSave(), permanentFailure());

            assertFalse(contains(commands, SessionCommand.ScheduleRetry.class));
            ErrorReport report = only(commands, SessionCommand.ShowError.class).report();
            assertFalse(report.retryOffered());
            assertEquals(ErrorCategory.VALIDATION_FAILURE, report.category());
            assertEquals(0, controller.state().retryAttempt());
            assertEquals(SessionPhase.SHOWING_ERROR, controller.phase());
        }

        @Test
        @DisplayName("Success after a retry resets the attempt counter")
        void successAfterRetry_resetsCounter() {
            send(new SessionMessage.UserEdit("Hello World"));
            SessionCommand.Save first = requestSave();
            SessionCommand.ScheduleRetry retry =
                    only(saveFailed(first, new RemoteStoreException("Read timed out", new SocketTimeoutException())),
                            SessionCommand.ScheduleRetry.class);
            assertEquals(Duration.ofSeconds(1), retry.delay());
            assertEquals(Duration.ofSeconds(1), controller.state().retryDelay());

            SessionCommand.Save second =
                    only(send(new SessionMessage.RetryTimerFired(retry.generation())), SessionCommand.Save.class);
            saveSucceeded(second);

            assertEquals(0, controller.state().retryAttempt());
            assertEquals(Duration.ZERO, controller.state().retryDelay());
            assertEquals(SessionPhase.EDITING, controller.phase());
        }

        @Test
        @DisplayName("A new save request is refused while one is in flight")
        void saveWhileSaving_isIgnored() {
            requestSave();
            assertTrue(send(new SessionMessage.SaveRequested()).isEmpty());
            assertTrue(send(new SessionMessage.RefreshRequested()).isEmpty());
            assertTrue(send(new SessionMessage.TransformRequested(BlockType.QUOTE)).isEmpty());
            assertNull(controller.state().pendingBlockType());
        }

        @Test
        @DisplayName("A retry timer outside RETRY_WAITING is ignored")
        void strayRetryTimer_isIgnored() {
            SessionCommand.Save save = requestSave();
            assertTrue(send(new SessionMessage.RetryTimerFired(save.generation())).isEmpty());
            assertEquals(SessionPhase.SAVING, controller.phase());
        }
    }

    @Nested
    @DisplayName("Block type transformation")
    class TransformTests {

        @BeforeEach
        void load() {
            loaded("b1", BlockType.PARAGRAPH, "Hello");
        }

        @Test
        @DisplayName("Transform saves the current text with the new type")
        void transform_savesWithNewType() {
            send(new SessionMessage.UserEdit("Hello World"));

            SessionCommand.Save save =
                    only(send(new SessionMessage.TransformRequested(BlockType.HEADING_2)), SessionCommand.Save.class);

            assertEquals(BlockType.HEADING_2, save.update().type());
            assertEquals("Hello World", save.update().text());
            assertEquals(BlockType.HEADING_2, controller.state().pendingBlockType());
            assertEquals(BlockType.PARAGRAPH, controller.state().blockType());
        }

        @Test
        @DisplayName("A successful save applies and clears the pending type")
        void success_appliesPendingType() {
            SessionCommand.Save save =
                    only(send(new SessionMessage.TransformRequested(BlockType.QUOTE)), SessionCommand.Save.class);

            saveSucceeded(save);

            assertEquals(BlockType.QUOTE, controller.state().blockType());
            assertNull(controller.state().pendingBlockType());
        }

        @Test
        @DisplayName("A failed save leaves the pending type queued for the next save")
        void failure_keepsPendingType() {
            SessionCommand.Save save =
                    only(send(new SessionMessage.TransformRequested(BlockType.QUOTE)), SessionCommand.Save.class);
            saveFailed(save, permanentFailure());
            send(new SessionMessage.ErrorAcknowledged(ErrorAction.DISMISS));

            assertEquals(BlockType.QUOTE, controller.state().pendingBlockType());
            assertEquals(BlockType.PARAGRAPH, controller.state().blockType());
            assertEquals(BlockType.QUOTE, requestSave().update().type());
        }

        @Test
        @DisplayName("A second transform before the first is saved overwrites the slot")
        void secondTransform_overwrites() {
            saveFailed(
                    only(send(new SessionMessage.TransformRequested(BlockType.QUOTE)), SessionCommand.Save.class),
                    permanentFailure());
            send(new SessionMessage.ErrorAcknowledged(ErrorAction.DISMISS));

            SessionCommand.Save save =
                    only(send(new SessionMessage.TransformRequested(BlockType.TO_DO)), SessionCommand.Save.class);
            saveSucceeded(save);

            assertEquals(BlockType.TO_DO, save.update().type());
            assertEquals(BlockType.TO_DO, controller.state().blockType());
        }

        @Test
        @DisplayName("Converting to code saves as plain text")
        void toCode_carriesLanguage() {
            SessionCommand.Save save =
                    only(send(new SessionMessage.TransformRequested(BlockType.CODE)), SessionCommand.Save.class);
            assertEquals("plain text", save.update().attributes().get("language"));
        }

        @Test
        @DisplayName("Transform is refused outside EDITING")
        void transform_refusedOutsideEditing() {
            send(new SessionMessage.UserEdit("Hello World"));
            send(new SessionMessage.ExitRequested());
            assertEquals(SessionPhase.CONFIRMING_EXIT, controller.phase());

            assertTrue(send(new SessionMessage.TransformRequested(BlockType.QUOTE)).isEmpty());
            assertNull(controller.state().pendingBlockType());
        }
    }

    @Nested
    @DisplayName("Exit gate")
    class ExitGateTests {

        @BeforeEach
        void load() {
            loaded("b1", BlockType.PARAGRAPH, "Hello");
        }

        @Test
        @DisplayName("Exit while clean exits at once")
        void exitClean_exits() {
            List<SessionCommand> commands = send(new SessionMessage.ExitRequested());

            assertEquals("b1", only(commands, SessionCommand.Exit.class).blockId());
            assertEquals(SessionPhase.EXITED, controller.phase());
        }

        @Test
        @DisplayName("Exit while dirty asks Save, Discard or Cancel")
        void exitDirty_confirms() {
            send(new SessionMessage.UserEdit("Hello World"));

            List<SessionCommand> commands = send(new SessionMessage.ExitRequested());

            SessionCommand.PresentConfirmation prompt = only(commands, SessionCommand.PresentConfirmation.class);
            assertEquals(
                    List.of(ConfirmationChoice.SAVE, ConfirmationChoice.DISCARD, ConfirmationChoice.CANCEL),
                    prompt.options());
            assertEquals("Unsaved Changes", prompt.title());
            assertFalse(contains(commands, SessionCommand.Exit.class));
            assertEquals(SessionPhase.CONFIRMING_EXIT, controller.phase());
        }

        @Test
        @DisplayName("Discard exits without saving and drops the pending type")
        void discard_exitsWithoutSave() {
            send(new SessionMessage.UserEdit("Hello World"));
            send(new SessionMessage.ExitRequested());

            List<SessionCommand> commands =
                    send(new SessionMessage.ConfirmationAnswered(ConfirmationChoice.DISCARD));

            assertFalse(contains(commands, SessionCommand.Save.class));
            only(commands, SessionCommand.Exit.class);
            assertEquals(SessionPhase.EXITED, controller.phase());
            assertNull(controller.state().pendingBlockType());
        }

        @Test
        @DisplayName("Cancel returns to dirty editing")
        void cancel_returnsToEditing() {
            send(new SessionMessage.UserEdit("Hello World"));
            send(new SessionMessage.ExitRequested());

            assertTrue(send(new SessionMessage.ConfirmationAnswered(ConfirmationChoice.CANCEL)).isEmpty());

            assertEquals(SessionPhase.EDITING, controller.phase());
            assertTrue(controller.state().dirty());
        }

        @Test
        @DisplayName("Save then exit ends the session once the save succeeds")
        void saveThenExit_success() {
            send(new SessionMessage.UserEdit("Hello World"));
            send(new SessionMessage.ExitRequested());

            SessionCommand.Save save =
                    only(send(new SessionMessage.ConfirmationAnswered(ConfirmationChoice.SAVE)), SessionCommand.Save.class);
            assertTrue(controller.state().quitAfterSave());
            assertEquals("Hello World", save.update().text());

            List<SessionCommand> commands = saveSucceeded(save);

            only(commands, SessionCommand.Exit.class);
            assertFalse(contains(commands, SessionCommand.ScheduleIndicatorClear.class));
            assertEquals(SessionPhase.EXITED, controller.phase());
            assertEquals("Hello World", controller.baselineText());
        }

        @Test
        @DisplayName("Save then exit survives transient retries")
        void saveThenExit_throughRetries() {
            send(new SessionMessage.UserEdit("Hello World"));
            send(new SessionMessage.ExitRequested());
            SessionCommand.Save save =
                    only(send(new SessionMessage.ConfirmationAnswered(ConfirmationChoice.SAVE)), SessionCommand.Save.class);
            SessionCommand.ScheduleRetry retry =
                    only(saveFailed(save, transientFailure()), SessionCommand.ScheduleRetry.class);
            assertTrue(controller.state().quitAfterSave());

            SessionCommand.Save again =
                    only(send(new SessionMessage.RetryTimerFired(retry.generation())), SessionCommand.Save.class);
            only(saveSucceeded(again), SessionCommand.Exit.class);
        }

        @Test
        @DisplayName("A failed save before exit shows the error instead of exiting")
        void saveThenExit_failure() {
            send(new SessionMessage.UserEdit("Hello World"));
            send(new SessionMessage.ExitRequested());
            SessionCommand.Save save =
                    only(send(new SessionMessage.ConfirmationAnswered(ConfirmationChoice.SAVE)), SessionCommand.Save.class);

            List<SessionCommand> commands = saveFailed(save, permanentFailure());

            assertFalse(contains(commands, SessionCommand.Exit.class));
            only(commands, SessionCommand.ShowError.class);
            assertEquals(SessionPhase.SHOWING_ERROR, controller.phase());
            assertTrue(controller.state().dirty());
        }

        @Test
        @DisplayName("Dismissing a failed save-then-exit keeps the session open")
        void dismissAfterFailedSaveThenExit_staysOpen() {
            send(new SessionMessage.UserEdit("Hello World"));
            send(new SessionMessage.ExitRequested());
            saveFailed(
                    only(send(new SessionMessage.ConfirmationAnswered(ConfirmationChoice.SAVE)), SessionCommand.Save.class),
                    permanentFailure());

            send(new SessionMessage.ErrorAcknowledged(ErrorAction.DISMISS));
            SessionCommand.Save save = requestSave();
            List<SessionCommand> commands = saveSucceeded(save);

            assertFalse(controller.state().quitAfterSave());
            assertFalse(contains(commands, SessionCommand.Exit.class));
            assertEquals(SessionPhase.EDITING, controller.phase());
        }

        @Test
        @DisplayName("Exit is ignored while a save is in flight")
        void exitWhileSaving_ignored() {
            requestSave();
            assertTrue(send(new SessionMessage.ExitRequested()).isEmpty());
            assertEquals(SessionPhase.SAVING, controller.phase());
        }
    }

    @Nested
    @DisplayName("Refresh")
    class RefreshTests {

        @BeforeEach
        void load() {
            loaded("b1", BlockType.PARAGRAPH, "Hello");
        }

        @Test
        @DisplayName("Refresh discards local edits and refetches under a new generation")
        void refresh_discardsEdits() {
            send(new SessionMessage.UserEdit("local edit"));
            long before = controller.state().generation();

            SessionCommand.Fetch fetch =
                    only(send(new SessionMessage.RefreshRequested()), SessionCommand.Fetch.class);

            assertEquals(before + 1, fetch.generation());
            assertEquals("Hello", controller.draft().getText());
            assertFalse(controller.state().dirty());
            assertTrue(controller.state().refreshing());
            assertEquals(SessionPhase.LOADING, controller.phase());
        }

        @Test
        @DisplayName("A completed refresh adopts the remote text and shows Refreshed")
        void refreshCompleted_adoptsRemote() {
            SessionCommand.Fetch fetch =
                    only(send(new SessionMessage.RefreshRequested()), SessionCommand.Fetch.class);

            List<SessionCommand> commands =
                    send(new SessionMessage.FetchSucceeded(fetch.generation(), content("b1", BlockType.QUOTE, "Remote")));

            only(commands, SessionCommand.ScheduleIndicatorClear.class);
            assertEquals(StatusIndicator.REFRESHED, controller.state().indicator());
            assertEquals("Remote", controller.baselineText());
            assertEquals("Remote", controller.draft().getText());
            assertEquals(BlockType.QUOTE, controller.state().blockType());
            assertFalse(controller.state().dirty());
        }

        @Test
        @DisplayName("Refresh after a failed transform clears the pending type and retry counter")
        void refreshAfterError_clearsPendingAndRetries() {
            SessionCommand.Save save =
                    only(send(new SessionMessage.TransformRequested(BlockType.QUOTE)), SessionCommand.Save.class);
            for (int i = 0; i < 3; i++) {
                SessionCommand.ScheduleRetry retry =
                        only(saveFailed(save, transientFailure()), SessionCommand.ScheduleRetry.class);
                save = only(send(new SessionMessage.RetryTimerFired(retry.generation())), SessionCommand.Save.class);
            }
            saveFailed(save, transientFailure());
            assertEquals(SessionPhase.SHOWING_ERROR, controller.phase());
            assertEquals(3, controller.state().retryAttempt());

            List<SessionCommand> commands = send(new SessionMessage.RefreshRequested());

            only(commands, SessionCommand.ClearError.class);
            only(commands, SessionCommand.Fetch.class);
            assertNull(controller.state().pendingBlockType());
            assertEquals(0, controller.state().retryAttempt());
            assertNull(controller.state().error());
        }

        @Test
        @DisplayName("Refresh from the exit prompt abandons the exit")
        void refreshFromConfirmation() {
            send(new SessionMessage.UserEdit("local"));
            send(new SessionMessage.ExitRequested());

            only(send(new SessionMessage.RefreshRequested()), SessionCommand.Fetch.class);

            assertEquals(SessionPhase.LOADING, controller.phase());
            assertFalse(controller.state().quitAfterSave());
        }

        @Test
        @DisplayName("Refresh is refused while waiting to retry")
        void refreshWhileRetryWaiting_ignored() {
            saveFailed(requestSave(), transientFailure());
            assertEquals(SessionPhase.RETRY_WAITING, controller.phase());

            assertTrue(send(new SessionMessage.RefreshRequested()).isEmpty());
            assertEquals(1, controller.state().retryAttempt());
        }

        @Test
        @DisplayName("A save result arriving after a refresh is discarded")
        void saveResultAfterRefresh_isStale() {
            SessionCommand.Save save = requestSave();
            saveFailed(save, permanentFailure());
            only(send(new SessionMessage.RefreshRequested()), SessionCommand.Fetch.class);

            assertTrue(saveSucceeded(save).isEmpty());
            assertEquals(SessionPhase.LOADING, controller.phase());
        }
    }

    @Nested
    @DisplayName("Error acknowledgement")
    class ErrorAckTests {

        @Test
        @DisplayName("Manual retry after exhausted retries resends the same payload from attempt 0")
        void manualRetry_resendsPayload() {
            controller = new SessionController(SessionConfig.builder().maxRetries(0).build());
            loaded("b1", BlockType.PARAGRAPH, "Hello");
            send(new SessionMessage.UserEdit("Hello World"));
            SessionCommand.Save save = requestSave();
            assertTrue(only(saveFailed(save, transientFailure()), SessionCommand.ShowError.class).report().retryOffered());

            List<SessionCommand> commands = send(new SessionMessage.ErrorAcknowledged(ErrorAction.RETRY));

            only(commands, SessionCommand.ClearError.class);
            assertEquals(save.update(), only(commands, SessionCommand.Save.class).update());
            assertEquals(0, controller.state().retryAttempt());
            assertEquals(SessionPhase.SAVING, controller.phase());
        }

        @Test
        @DisplayName("Manual retry is refused when not offered")
        void manualRetry_refusedWhenNotOffered() {
            loaded("b1", BlockType.PARAGRAPH, "Hello");
            saveFailed(requestSave(), permanentFailure());

            assertTrue(send(new SessionMessage.ErrorAcknowledged(ErrorAction.RETRY)).isEmpty());
            assertEquals(SessionPhase.SHOWING_ERROR, controller.phase());
        }

        @Test
        @DisplayName("Dismiss returns to editing with the error cleared")
        void dismiss_returnsToEditing() {
            loaded("b1", BlockType.PARAGRAPH, "Hello");
            send(new SessionMessage.UserEdit("Hello World"));
            saveFailed(requestSave(), permanentFailure());

            List<SessionCommand> commands = send(new SessionMessage.ErrorAcknowledged(ErrorAction.DISMISS));

            only(commands, SessionCommand.ClearError.class);
            assertEquals(SessionPhase.EDITING, controller.phase());
            assertNull(controller.state().error());
            assertTrue(controller.state().dirty());
        }

        @Test
        @DisplayName("Dismissing a failed load exits, there is nothing to edit")
        void dismissFailedLoad_exits() {
            SessionCommand.Fetch fetch = only(send(new SessionMessage.LoadBlock("b1")), SessionCommand.Fetch.class);
            send(new SessionMessage.FetchFailed(fetch.generation(), permanentFailure()));

            List<SessionCommand> commands = send(new SessionMessage.ErrorAcknowledged(ErrorAction.DISMISS));

            only(commands, SessionCommand.Exit.class);
            assertEquals(SessionPhase.EXITED, controller.phase());
        }

        @Test
        @DisplayName("Retrying a transient load failure refetches under a new generation")
        void retryFailedLoad_refetches() {
            SessionCommand.Fetch fetch = only(send(new SessionMessage.LoadBlock("b1")), SessionCommand.Fetch.class);
            send(new SessionMessage.FetchFailed(fetch.generation(), new SocketTimeoutException("connect timed out")));
            assertTrue(controller.state().error().retryOffered());

            SessionCommand.Fetch again =
                    only(send(new SessionMessage.ErrorAcknowledged(ErrorAction.RETRY)), SessionCommand.Fetch.class);
            assertEquals(fetch.generation() + 1, again.generation());

            send(new SessionMessage.FetchSucceeded(again.generation(), content("b1", BlockType.PARAGRAPH, "Hi")));
            assertEquals(SessionPhase.EDITING, controller.phase());
            assertEquals("Hi", controller.draft().getText());
        }
    }

    @Nested
    @DisplayName("Indicators and listeners")
    class IndicatorTests {

        @BeforeEach
        void load() {
            loaded("b1", BlockType.PARAGRAPH, "Hello");
        }

        @Test
        @DisplayName("A successful save shows Saved until its timer fires")
        void savedIndicator_clearsOnTimer() {
            SessionCommand.ScheduleIndicatorClear clear =
                    only(saveSucceeded(requestSave()), SessionCommand.ScheduleIndicatorClear.class);
            assertEquals(SessionConfig.DEFAULT_INDICATOR_DELAY, clear.delay());
            assertEquals(StatusIndicator.SAVED, controller.state().indicator());

            send(new SessionMessage.IndicatorTimerFired(clear.generation(), clear.ticket()));

            assertEquals(StatusIndicator.NONE, controller.state().indicator());
        }

        @Test
        @DisplayName("An older indicator timer does not clear a newer indicator")
        void olderTicket_ignored() {
            SessionCommand.ScheduleIndicatorClear first =
                    only(saveSucceeded(requestSave()), SessionCommand.ScheduleIndicatorClear.class);
            only(saveSucceeded(requestSave()), SessionCommand.ScheduleIndicatorClear.class);

            send(new SessionMessage.IndicatorTimerFired(first.generation(), first.ticket()));

            assertEquals(StatusIndicator.SAVED, controller.state().indicator());
        }

        @Test
        @DisplayName("Editing after a save hides the Saved indicator")
        void edit_hidesIndicator() {
            saveSucceeded(requestSave());
            send(new SessionMessage.UserEdit("more"));
            assertEquals(StatusIndicator.NONE, controller.state().indicator());
        }

        @Test
        @DisplayName("Listeners see every phase of a save")
        void listeners_seePhases() {
            List<SessionPhase> phases = new ArrayList<>();
            controller.addStateListener((previous, current) -> phases.add(current.phase()));

            send(new SessionMessage.UserEdit("Hello World"));
            saveSucceeded(requestSave());

            assertEquals(List.of(SessionPhase.EDITING, SessionPhase.SAVING, SessionPhase.EDITING), phases);
        }
    }
}
