package com.chicu.tradeads.engine;

import com.chicu.tradeads.live.AdEventSink;
import com.chicu.tradeads.live.AdPostedEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Цикл одного объявления: POSTING → DECIDING → WAITING → POSTING ...
 *
 * Потоком не владеет: публикация идёт асинхронно, ожидание через колбэк таймера.
 * Выход (CANCELLED / CONFIG_FATAL) всегда через removeIfCurrent с поколением цикла.
 */
@Slf4j
final class AdJobLoop {

    enum State { POSTING, DECIDING, WAITING, CANCELLED, CONFIG_FATAL }

    private final AdJob job;
    private final OptionalInt intervalMinutes;
    private final Duration fallbackWait;
    private final long generation;

    private final TradeAdPoster poster;
    private final AdEventSink sink;
    private final PostCountLedger ledger;
    private final JobRegistry registry;
    private final AdTimer timer;

    private final CancellationSignal signal;
    private final AtomicBoolean finished = new AtomicBoolean(false);

    private volatile State state = State.WAITING;

    AdJobLoop(AdJob job,
              OptionalInt intervalMinutes,
              Duration fallbackWait,
              long generation,
              TradeAdPoster poster,
              AdEventSink sink,
              PostCountLedger ledger,
              JobRegistry registry,
              AdTimer timer) {
        this.job = job;
        this.intervalMinutes = intervalMinutes;
        this.fallbackWait = fallbackWait;
        this.generation = generation;
        this.poster = poster;
        this.sink = sink;
        this.ledger = ledger;
        this.registry = registry;
        this.timer = timer;
        this.signal = new CancellationSignal(() -> finish(State.CANCELLED));
    }

    CancellationSignal signal() {
        return signal;
    }

    long generation() {
        return generation;
    }

    State state() {
        return state;
    }

    /** Первая публикация сразу, но через таймер, чтобы stop до неё тоже сработал */
    void start() {
        awaitNext(Duration.ZERO);
    }

    // =====================================================
    // POSTING
    // =====================================================
    private void postCycle() {
        signal.waitElapsed();
        state = State.POSTING;

        if (!job.hasCredential()) {
            log.warn("⚠ Ad {} missing roli_verification, skipping post", job.id());
            decide(PostOutcome.skipped());
            return;
        }

        CompletableFuture<PostOutcome> call;
        try {
            call = poster.post(job);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        call.whenComplete((outcome, error) -> {
            if (error != null || outcome == null) {
                decide(PostResultClassifier.transportFailure(unwrap(error)));
            } else {
                decide(outcome);
            }
        });
    }

    // =====================================================
    // DECIDING
    // =====================================================
    private void decide(PostOutcome outcome) {
        state = State.DECIDING;

        long count = outcome.isSuccess() ? ledger.increment(job.id()) : ledger.get(job.id());

        if (outcome.kind().isFailure()) {
            log.warn("❌ Ad {} failed to post [{}]: {}", job.id(), outcome.kind(), outcome.reason());
        } else {
            log.debug("Ad {} cycle outcome={} count={}", job.id(), outcome.kind(), count);
        }

        emit(AdPostedEvent.fromOutcome(job.id(), count, outcome));

        Duration wait;
        if (outcome.isSuccess()) {
            if (intervalMinutes.isEmpty()) {
                log.error("❌ Ad {} has no effective interval, stopping loop (generation={})",
                        job.id(), generation);
                emit(AdPostedEvent.configFatal(job.id(), count));
                finish(State.CONFIG_FATAL);
                return;
            }
            wait = Duration.ofMinutes(Math.max(1, intervalMinutes.getAsInt()));
        } else {
            wait = intervalMinutes.isPresent()
                    ? Duration.ofMinutes(Math.max(1, intervalMinutes.getAsInt()))
                    : fallbackWait;
        }

        awaitNext(wait);
    }

    // =====================================================
    // WAITING
    // =====================================================
    private void awaitNext(Duration wait) {
        state = State.WAITING;
        boolean armed = signal.armWait(() -> timer.schedule(this::postCycle, wait));
        if (!armed) {
            finish(State.CANCELLED);
            return;
        }
        log.debug("Ad {} next post in {}", job.id(), wait);
    }

    // =====================================================
    // EXIT
    // =====================================================
    private void finish(State terminal) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        state = terminal;
        boolean deregistered = registry.removeIfCurrent(job.id(), generation);
        log.info("■ Ad loop {} exiting ({}), generation={}, deregistered={}",
                job.id(), terminal, generation, deregistered);
    }

    private void emit(AdPostedEvent event) {
        try {
            sink.emit(event);
        } catch (Exception e) {
            log.warn("⚠ Ad {} event delivery failed: {}", job.id(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof java.util.concurrent.CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
