package com.chicu.tradeads.engine;

import lombok.Getter;

/**
 * Запуск объявления отклонён.
 */
@Getter
public class AdStartException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        INTERVAL_TOO_SHORT,
        NO_INTERVAL_CONFIGURED
    }

    private final Reason reason;
    private final String adId;

    public AdStartException(Reason reason, String adId, String message) {
        super(message);
        this.reason = reason;
        this.adId = adId;
    }
}
