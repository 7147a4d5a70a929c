package com.chicu.tradeads.engine;

public enum StartResult {
    STARTED("started"),
    /** Повторный start не ошибка, просто no-op */
    ALREADY_RUNNING("already_running");

    private final String value;

    StartResult(String value) { this.value = value; }

    public String value() { return value; }
}
