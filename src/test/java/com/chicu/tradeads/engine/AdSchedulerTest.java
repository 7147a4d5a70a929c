package com.chicu.tradeads.engine;

import com.chicu.tradeads.config.AdsSchedulerProperties;
import com.chicu.tradeads.live.AdPostedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AdSchedulerTest {

    private final Map<String, AdJob> jobs = new HashMap<>();
    private final ManualAdTimer timer = new ManualAdTimer();
    private final ScriptedPoster poster = new ScriptedPoster();
    private final RecordingSink sink = new RecordingSink();

    private AdsSchedulerProperties props;
    private AdScheduler scheduler;

    @BeforeEach
    void setUp() {
        props = new AdsSchedulerProperties();
        scheduler = new AdScheduler(id -> Optional.ofNullable(jobs.get(id)), poster, sink, timer, props);
    }

    private static AdJob job(String id, String cookie, int intervalMinutes) {
        return new AdJob(id, "ad " + id, 42L, cookie, List.of(1L, 2L), List.of(), List.of("any"), intervalMinutes);
    }

    private void register(AdJob job) {
        jobs.put(job.id(), job);
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        void secondStart_shouldBeNoOp_andKeepSingleLoop() {
            register(job("a", "cookie", 30));

            assertEquals(StartResult.STARTED, scheduler.start("a", null));
            assertEquals(StartResult.ALREADY_RUNNING, scheduler.start("a", null));

            assertEquals(1, timer.livePending(), "должен быть взведён ровно один цикл");

            assertEquals(Duration.ZERO, timer.fireNext());
            assertEquals(1, poster.calls());
            assertEquals(1, timer.livePending());
            assertEquals(Duration.ofMinutes(30), timer.lastDelay());
        }

        @Test
        void concurrentStarts_shouldSpawnExactlyOneLoop() throws Exception {
            register(job("a", "cookie", 30));

            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<StartResult>> results = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    results.add(pool.submit(() -> {
                        go.await();
                        return scheduler.start("a", null);
                    }));
                }
                go.countDown();

                int started = 0;
                for (Future<StartResult> f : results) {
                    if (f.get(5, TimeUnit.SECONDS) == StartResult.STARTED) started++;
                }
                assertEquals(1, started);
            } finally {
                pool.shutdownNow();
            }

            assertEquals(Optional.of(1L), scheduler.generationOf("a"));
            assertEquals(1, timer.livePending());
        }

        @Test
        void unknownAd_shouldBeRejected() {
            AdStartException e = assertThrows(AdStartException.class, () -> scheduler.start("ghost", null));
            assertEquals(AdStartException.Reason.NOT_FOUND, e.getReason());
            assertTrue(scheduler.listRunning().isEmpty());
        }

        @Test
        void overrideBelowMinimum_shouldBeRejected() {
            register(job("a", "cookie", 30));

            AdStartException e = assertThrows(AdStartException.class, () -> scheduler.start("a", 5));
            assertEquals(AdStartException.Reason.INTERVAL_TOO_SHORT, e.getReason());
            assertFalse(scheduler.isRunning("a"));
        }

        @Test
        void storedIntervalBelowMinimum_shouldBeRejected() {
            register(job("b", "cookie", 10));

            AdStartException e = assertThrows(AdStartException.class, () -> scheduler.start("b", null));
            assertEquals(AdStartException.Reason.INTERVAL_TOO_SHORT, e.getReason());
        }

        @Test
        void noIntervalAnywhere_shouldBeRejected() {
            register(job("c", "cookie", 0));

            AdStartException e = assertThrows(AdStartException.class, () -> scheduler.start("c", null));
            assertEquals(AdStartException.Reason.NO_INTERVAL_CONFIGURED, e.getReason());
            assertTrue(scheduler.listRunning().isEmpty());
            assertEquals(0, timer.livePending());
        }

        @Test
        void override_shouldReplaceStoredIntervalBelowMinimum() {
            props.setMinIntervalMinutes(30);
            register(job("a", "cookie", 20));

            assertEquals(StartResult.STARTED, scheduler.start("a", 60));
            timer.fireNext();

            assertEquals(Duration.ofMinutes(60), timer.lastDelay());
        }

        @Test
        void storedIntervalBelowMinimum_withShortOverride_shouldStillBeRejected() {
            props.setMinIntervalMinutes(30);
            register(job("a", "cookie", 20));

            AdStartException e = assertThrows(AdStartException.class, () -> scheduler.start("a", 25));
            assertEquals(AdStartException.Reason.INTERVAL_TOO_SHORT, e.getReason());
        }

        @Test
        void override_shouldWinOverInheritedInterval() {
            register(job("c", "cookie", 0));

            assertEquals(StartResult.STARTED, scheduler.start("c", 45));
            timer.fireNext();

            assertEquals(Duration.ofMinutes(45), timer.lastDelay());
        }
    }

    @Nested
    @DisplayName("stop")
    class Stop {

        @Test
        void stopWhileWaiting_shouldCancelTimerAndDeregister() {
            register(job("a", "cookie", 30));
            scheduler.start("a", null);
            timer.fireNext();

            scheduler.stop("a");

            assertFalse(scheduler.listRunning().contains("a"));
            assertEquals(0, timer.livePending());
            assertNull(timer.fireNext());
            assertEquals(1, poster.calls());
        }

        @Test
        void stopBeforeFirstPost_shouldNeverPost() {
            register(job("a", "cookie", 30));
            scheduler.start("a", null);

            scheduler.stop("a");

            assertNull(timer.fireNext());
            assertEquals(0, poster.calls());
            assertTrue(sink.events.isEmpty());
        }

        @Test
        void stopUnknownOrStopped_shouldBeNoOp() {
            assertDoesNotThrow(() -> scheduler.stop("ghost"));

            register(job("a", "cookie", 30));
            scheduler.start("a", null);
            scheduler.stop("a");

            assertDoesNotThrow(() -> scheduler.stop("a"));
            assertTrue(scheduler.listRunning().isEmpty());
        }

        @Test
        void stopMidPost_shouldFinishPostThenExit() {
            register(job("a", "cookie", 30));
            CompletableFuture<PostOutcome> inFlight = poster.thenPending();

            scheduler.start("a", null);
            timer.fireNext();

            scheduler.stop("a");
            assertFalse(scheduler.isRunning("a"));

            inFlight.complete(PostOutcome.success(200));

            assertEquals(1, sink.events.size(), "начатая публикация доводится до конца");
            assertEquals(1, scheduler.postCount("a"));
            assertEquals(0, timer.livePending(), "после отмены цикл не перевзводится");
        }

        @Test
        void restartBeforeStaleCleanup_shouldKeepNewLoopRegisteredAndStoppable() {
            register(job("a", "cookie", 30));
            CompletableFuture<PostOutcome> staleInFlight = poster.thenPending();

            scheduler.start("a", null);
            assertEquals(Optional.of(1L), scheduler.generationOf("a"));
            timer.fireNext();

            scheduler.stop("a");
            assertEquals(StartResult.STARTED, scheduler.start("a", null));
            assertEquals(Optional.of(2L), scheduler.generationOf("a"));

            // старый цикл (поколение 1) доходит до выхода уже после нового старта
            staleInFlight.complete(PostOutcome.success(200));

            assertTrue(scheduler.listRunning().contains("a"));
            assertEquals(Optional.of(2L), scheduler.generationOf("a"));

            timer.fireNext();
            assertTrue(scheduler.listRunning().contains("a"));

            scheduler.stop("a");
            assertFalse(scheduler.listRunning().contains("a"));
            assertEquals(0, timer.livePending());
            assertEquals(List.of(1L, 2L), sink.counts());
        }

        @Test
        void shutdown_shouldCancelEverything() {
            register(job("a", "cookie", 30));
            register(job("b", "cookie", 60));
            scheduler.start("a", null);
            scheduler.start("b", null);
            timer.fireNext();
            timer.fireNext();

            scheduler.shutdown();

            assertTrue(scheduler.listRunning().isEmpty());
            assertEquals(0, timer.livePending());
        }
    }

    @Nested
    @DisplayName("loop")
    class Loop {

        @Test
        void postCount_shouldGrowOnlyOnSuccess() {
            register(job("a", "cookie", 30));
            poster.then(PostOutcome.success(200))
                    .then(PostResultClassifier.classify(500, "internal error"))
                    .thenFailure(new IOException("connection reset"))
                    .then(PostOutcome.success(201))
                    .then(PostResultClassifier.classify(403, "verification_required"))
                    .then(PostOutcome.success(200));

            scheduler.start("a", null);
            for (int i = 0; i < 6; i++) {
                assertNotNull(timer.fireNext());
            }

            assertEquals(List.of(1L, 1L, 1L, 2L, 2L, 3L), sink.counts());
            assertEquals(3, scheduler.postCount("a"));
            assertEquals("trade ad post success (3)", sink.last().getMessage());
            assertEquals(Duration.ofMinutes(30), timer.lastDelay());
            assertTrue(scheduler.isRunning("a"));
        }

        @Test
        void failureEvents_shouldCarryKindAndReason() {
            register(job("a", "cookie", 30));
            poster.then(PostResultClassifier.classify(403, "verification_required"))
                    .then(PostResultClassifier.classify(500, "{\"success\":false,\"code\":7107}"))
                    .thenFailure(new IOException("timeout"));

            scheduler.start("a", null);
            timer.fireNext();
            timer.fireNext();
            timer.fireNext();

            AdPostedEvent verification = sink.events.get(0);
            assertEquals("verification", verification.getErrorKind());
            assertEquals("trade ad post failed (verification_required)", verification.getMessage());

            AdPostedEvent api = sink.events.get(1);
            assertEquals("api", api.getErrorKind());
            assertEquals(7107L, api.getErrorCode());
            assertTrue(api.getMessage().startsWith("trade ad post error: "));

            AdPostedEvent network = sink.events.get(2);
            assertEquals("network", network.getErrorKind());
            assertEquals("timeout", network.getReason());
        }

        @Test
        void missingCredential_shouldSkipWithoutNetworkCall() {
            register(job("s", "  ", 30));

            scheduler.start("s", null);
            timer.fireNext();

            assertEquals(0, poster.calls());
            assertEquals("trade ad post skipped (no roli_verification)", sink.last().getMessage());
            assertNull(sink.last().getErrorKind());
            assertEquals(0, scheduler.postCount("s"));
            assertEquals(Duration.ofMinutes(30), timer.lastDelay());
            assertTrue(scheduler.isRunning("s"));
        }

        @Test
        void unsetInterval_shouldStopAfterSuccess() {
            assertEquals(StartResult.STARTED, scheduler.launch(job("z", "cookie", 0), OptionalInt.empty()));

            timer.fireNext();

            assertEquals(2, sink.events.size());
            assertEquals("trade ad post success", sink.events.get(0).getMessage());
            assertEquals(AdPostedEvent.KIND_CONFIG, sink.last().getErrorKind());
            assertFalse(scheduler.isRunning("z"));
            assertEquals(0, timer.livePending());
        }

        @Test
        void unsetInterval_failureShouldFallBackAndKeepRunning() {
            poster.then(PostResultClassifier.classify(500, "internal error"));
            scheduler.launch(job("f", "cookie", 0), OptionalInt.empty());

            timer.fireNext();

            assertTrue(scheduler.isRunning("f"));
            assertEquals(Duration.ofMinutes(props.getFallbackRetryMinutes()), timer.lastDelay());

            // следующий цикл успешен → интервала нет → выход
            timer.fireNext();
            assertFalse(scheduler.isRunning("f"));
        }

        @Test
        void brokenSink_shouldNotStopLoop() {
            AdScheduler withBrokenSink = new AdScheduler(
                    id -> Optional.ofNullable(jobs.get(id)),
                    poster,
                    e -> { throw new IllegalStateException("ws down"); },
                    timer,
                    props);
            register(job("a", "cookie", 30));

            withBrokenSink.start("a", null);
            timer.fireNext();
            timer.fireNext();

            assertEquals(2, poster.calls());
            assertEquals(2, withBrokenSink.postCount("a"));
            assertTrue(withBrokenSink.isRunning("a"));
        }

        @Test
        void runningAds_shouldExposeGenerationAndCount() {
            register(job("a", "cookie", 30));
            scheduler.start("a", null);
            timer.fireNext();

            List<RunningAd> running = scheduler.runningAds();

            assertEquals(1, running.size());
            assertEquals("a", running.get(0).id());
            assertEquals(1L, running.get(0).generation());
            assertEquals(1L, running.get(0).postCount());
            assertNotNull(running.get(0).startedAt());
        }
    }
}
