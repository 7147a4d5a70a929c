package com.chicu.tradeads.engine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Счётчик успешных публикаций по id объявления.
 * Живёт в памяти процесса, stop/start его не сбрасывают.
 */
public class PostCountLedger {

    private final Map<String, Long> counts = new ConcurrentHashMap<>();

    long increment(String id) {
        return counts.merge(id, 1L, Long::sum);
    }

    public long get(String id) {
        return counts.getOrDefault(id, 0L);
    }

    public Map<String, Long> snapshot() {
        return Map.copyOf(counts);
    }
}
