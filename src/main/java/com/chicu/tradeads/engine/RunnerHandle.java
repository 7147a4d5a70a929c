package com.chicu.tradeads.engine;

import java.time.Instant;

/**
 * Запись реестра: сигнал остановки + поколение живого цикла.
 */
record RunnerHandle(long generation, CancellationSignal signal, Instant startedAt) {
}
