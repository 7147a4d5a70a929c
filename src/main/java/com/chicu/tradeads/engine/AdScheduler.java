package com.chicu.tradeads.engine;

import com.chicu.tradeads.config.AdsSchedulerProperties;
import com.chicu.tradeads.live.AdEventSink;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Планировщик фоновой публикации объявлений: start / stop / list.
 *
 * Один независимый цикл на объявление. Реестр, счётчик поколений и счётчик публикаций
 * принадлежат этому сервису и живут столько же, сколько процесс; после рестарта
 * ничего не восстанавливается.
 */
@Slf4j
@Service
public class AdScheduler {

    private final AdJobSource jobSource;
    private final TradeAdPoster poster;
    private final AdEventSink sink;
    private final AdTimer timer;
    private final AdsSchedulerProperties props;

    private final GenerationCounter generations = new GenerationCounter();
    private final JobRegistry registry = new JobRegistry(generations);
    private final PostCountLedger ledger = new PostCountLedger();

    public AdScheduler(AdJobSource jobSource,
                       TradeAdPoster poster,
                       AdEventSink sink,
                       AdTimer timer,
                       AdsSchedulerProperties props) {
        this.jobSource = jobSource;
        this.poster = poster;
        this.sink = sink;
        this.timer = timer;
        this.props = props;
    }

    // ==============================================================
    // ▶️ START
    // ==============================================================

    /**
     * Запустить цикл объявления.
     *
     * @param overrideMinutes интервал из запроса, null = брать сохранённый
     * @throws AdStartException объявление не найдено, интервал меньше минимума или не задан вовсе
     */
    public StartResult start(String id, Integer overrideMinutes) {
        if (registry.contains(id)) {
            log.debug("Ad {} already running, start is a no-op", id);
            return StartResult.ALREADY_RUNNING;
        }

        AdJob job = jobSource.load(id)
                .orElseThrow(() -> new AdStartException(AdStartException.Reason.NOT_FOUND, id,
                        "Ad not found: " + id));

        int min = props.getMinIntervalMinutes();
        if (overrideMinutes != null && overrideMinutes < min) {
            throw new AdStartException(AdStartException.Reason.INTERVAL_TOO_SHORT, id,
                    "Interval must be at least " + min + " minutes");
        }
        // override заменяет сохранённое значение, проверяем только то, что реально поедет в цикл
        if (overrideMinutes == null && job.intervalMinutes() != 0 && job.intervalMinutes() < min) {
            throw new AdStartException(AdStartException.Reason.INTERVAL_TOO_SHORT, id,
                    "Interval must be at least " + min + " minutes or 0 to inherit global interval");
        }

        OptionalInt interval = IntervalResolver.resolve(overrideMinutes, job.intervalMinutes());
        if (interval.isEmpty()) {
            throw new AdStartException(AdStartException.Reason.NO_INTERVAL_CONFIGURED, id,
                    "No posting interval specified. Set a global interval or provide intervalMinutes when starting the ad.");
        }

        return launch(job, interval);
    }

    /**
     * Занять слот и запустить цикл. Интервал не проверяется: пустой интервал
     * приведёт к остановке цикла после первого успешного поста.
     */
    StartResult launch(AdJob job, OptionalInt interval) {
        Duration fallback = Duration.ofMinutes(Math.max(1, props.getFallbackRetryMinutes()));
        AtomicReference<AdJobLoop> spawned = new AtomicReference<>();

        Optional<RunnerHandle> handle = registry.reserve(job.id(), generation -> {
            AdJobLoop loop = new AdJobLoop(job, interval, fallback, generation,
                    poster, sink, ledger, registry, timer);
            spawned.set(loop);
            return new RunnerHandle(generation, loop.signal(), Instant.now());
        });

        if (handle.isEmpty()) {
            log.debug("Ad {} lost the start race, already running", job.id());
            return StartResult.ALREADY_RUNNING;
        }

        spawned.get().start();
        log.info("🚀 Ad {} started (generation={}, interval={})",
                job.id(), handle.get().generation(),
                interval.isPresent() ? interval.getAsInt() + "m" : "unset");
        return StartResult.STARTED;
    }

    // ==============================================================
    // ⏹ STOP
    // ==============================================================
    public void stop(String id) {
        if (registry.cancel(id)) {
            log.info("🛑 Ad {} stop requested", id);
        } else {
            log.debug("Ad {} is not running, stop is a no-op", id);
        }
    }

    // ==============================================================
    // ℹ STATUS
    // ==============================================================
    public Set<String> listRunning() {
        return registry.list();
    }

    public boolean isRunning(String id) {
        return registry.contains(id);
    }

    public List<RunningAd> runningAds() {
        return registry.snapshot().entrySet().stream()
                .map(e -> new RunningAd(
                        e.getKey(),
                        e.getValue().generation(),
                        e.getValue().startedAt(),
                        ledger.get(e.getKey())))
                .sorted(Comparator.comparing(RunningAd::startedAt))
                .toList();
    }

    public long postCount(String id) {
        return ledger.get(id);
    }

    /** Поколение текущего цикла объявления, если он есть */
    Optional<Long> generationOf(String id) {
        return registry.get(id).map(RunnerHandle::generation);
    }

    // ==============================================================
    // 🛑 SHUTDOWN
    // ==============================================================
    @PreDestroy
    public void shutdown() {
        int cancelled = registry.cancelAll();
        log.info("💤 AdScheduler shutting down, cancelled {} ad loop(s)", cancelled);
    }
}
