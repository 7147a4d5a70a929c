package com.chicu.tradeads.engine;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link AdTimer} поверх общего ScheduledThreadPoolExecutor.
 * Несколько daemon-потоков обслуживают все объявления сразу.
 */
@Slf4j
public class ExecutorAdTimer implements AdTimer {

    /** Имена вида: ad-timer-1, ad-timer-2, ... */
    private static final class AdTimerThreadFactory implements ThreadFactory {
        private final AtomicLong ctr = new AtomicLong(1);
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("ad-timer-" + ctr.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private final ScheduledThreadPoolExecutor executor;

    public ExecutorAdTimer(int poolSize) {
        this.executor = new ScheduledThreadPoolExecutor(Math.max(1, poolSize), new AdTimerThreadFactory());
        // снятое ожидание держит ссылку на весь цикл; без этого оно висит в очереди до своего срока
        this.executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public TimerHandle schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(
                task,
                Math.max(0L, delay.toMillis()),
                TimeUnit.MILLISECONDS
        );
        return () -> future.cancel(false);
    }

    /** Задачи, ещё стоящие в очереди таймера */
    int queuedTasks() {
        return executor.getQueue().size();
    }

    public void shutdown() {
        log.info("💤 ExecutorAdTimer shutting down…");
        executor.shutdownNow();
    }
}
