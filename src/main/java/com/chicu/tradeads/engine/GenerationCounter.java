package com.chicu.tradeads.engine;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Поколения запусков: +1 на каждый spawn, значения не переиспользуются.
 * Сравниваются только на равенство («это всё ещё я?»).
 */
final class GenerationCounter {

    private final AtomicLong last = new AtomicLong();

    long next() {
        return last.incrementAndGet();
    }

    long current() {
        return last.get();
    }
}
