package com.chicu.tradeads.engine;

import java.util.List;

/**
 * Снимок настроек объявления, который получает планировщик при старте.
 * Хранилище владеет оригиналом, сюда попадает только неизменяемая копия.
 *
 * @param intervalMinutes сохранённый интервал, 0 = «своего значения нет»
 */
public record AdJob(
        String id,
        String name,
        long playerId,
        String roliVerification,
        List<Long> offerItemIds,
        List<Long> requestItemIds,
        List<String> requestTags,
        int intervalMinutes
) {

    public AdJob {
        offerItemIds = offerItemIds == null ? List.of() : List.copyOf(offerItemIds);
        requestItemIds = requestItemIds == null ? List.of() : List.copyOf(requestItemIds);
        requestTags = requestTags == null ? List.of() : List.copyOf(requestTags);
    }

    public boolean hasCredential() {
        return roliVerification != null && !roliVerification.isBlank();
    }
}
