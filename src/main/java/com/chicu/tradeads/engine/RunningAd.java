package com.chicu.tradeads.engine;

import java.time.Instant;

/** Снимок запущенного объявления для API */
public record RunningAd(String id, long generation, Instant startedAt, long postCount) {
}
