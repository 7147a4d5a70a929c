package com.chicu.tradeads.engine;

import java.time.Duration;

/**
 * Источник отложенных вызовов для циклов публикации.
 * Ожидание не держит поток: цикл просто перевзводится как колбэк таймера.
 */
public interface AdTimer {

    TimerHandle schedule(Runnable task, Duration delay);

    interface TimerHandle {

        /**
         * Отмена ещё не начавшегося вызова.
         *
         * @return true если задача снята и уже не запустится
         */
        boolean cancel();
    }
}
