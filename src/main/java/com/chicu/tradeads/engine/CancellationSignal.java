package com.chicu.tradeads.engine;

import java.util.function.Supplier;

/**
 * Одноразовый сигнал остановки цикла объявления.
 *
 * Отмена кооперативная: её видно только в состоянии ожидания.
 * Если цикл сейчас ждёт, таймер снимается и сразу вызывается onCancelledWhileWaiting.
 * Если цикл посреди публикации, он её доделает и выйдет на следующем ожидании.
 */
final class CancellationSignal {

    private final Runnable onCancelledWhileWaiting;

    private AdTimer.TimerHandle pendingWait;
    private boolean cancelled;

    CancellationSignal(Runnable onCancelledWhileWaiting) {
        this.onCancelledWhileWaiting = onCancelledWhileWaiting;
    }

    /**
     * Взвести ожидание, если отмены ещё не было.
     *
     * @return false если сигнал уже отправлен и ждать не нужно
     */
    synchronized boolean armWait(Supplier<AdTimer.TimerHandle> arm) {
        if (cancelled) {
            return false;
        }
        pendingWait = arm.get();
        return true;
    }

    /** Таймер сработал, ожидание закончилось */
    synchronized void waitElapsed() {
        pendingWait = null;
    }

    synchronized boolean isCancelled() {
        return cancelled;
    }

    void cancel() {
        AdTimer.TimerHandle wait;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            wait = pendingWait;
            pendingWait = null;
        }
        // снять удалось → колбэк таймера уже не придёт, выходим здесь
        if (wait != null && wait.cancel()) {
            onCancelledWhileWaiting.run();
        }
    }
}
