package com.chicu.tradeads.engine;

/** Итог одной попытки публикации. */
public enum PostOutcomeKind {

    SUCCESS(null),
    SKIPPED(null),
    VERIFICATION("verification"),
    API_ERROR("api"),
    NETWORK_ERROR("network");

    private final String tag;

    PostOutcomeKind(String tag) { this.tag = tag; }

    /** Метка для UI-события, null для не-ошибок */
    public String tag() { return tag; }

    public boolean isFailure() {
        return tag != null;
    }
}
