package com.chicu.tradeads.live;

import com.chicu.tradeads.engine.PostOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * Событие цикла публикации для UI (topic /topic/ads/posted).
 * Один цикл → ровно одно событие; плюс финальное при фатальной ошибке конфигурации.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdPostedEvent {

    public static final String KIND_CONFIG = "config";

    /** id объявления */
    private String id;

    /** Сколько успешных публикаций на текущий момент */
    private long count;

    /** Короткое сообщение для терминала UI */
    private String message;

    /** verification | api | network | config, null для успеха/пропуска */
    private String errorKind;

    /** Сырой диагностический текст */
    private String reason;

    /** Код ошибки из JSON-ответа API */
    private Long errorCode;

    /** epoch millis */
    private long time;

    public static AdPostedEvent fromOutcome(String id, long count, PostOutcome outcome) {
        AdPostedEventBuilder b = AdPostedEvent.builder()
                .id(id)
                .count(count)
                .time(System.currentTimeMillis());

        switch (outcome.kind()) {
            case SUCCESS -> b.message(count <= 1
                    ? "trade ad post success"
                    : "trade ad post success (" + count + ")");
            case SKIPPED -> b.message("trade ad post skipped (no roli_verification)");
            case VERIFICATION -> b.message("trade ad post failed (verification_required)")
                    .errorKind(outcome.kind().tag())
                    .reason(outcome.reason())
                    .errorCode(outcome.errorCode());
            case API_ERROR, NETWORK_ERROR -> b.message("trade ad post error: " + outcome.reason())
                    .errorKind(outcome.kind().tag())
                    .reason(outcome.reason())
                    .errorCode(outcome.errorCode());
        }
        return b.build();
    }

    public static AdPostedEvent configFatal(String id, long count) {
        return AdPostedEvent.builder()
                .id(id)
                .count(count)
                .message("trade ad stopped: no posting interval configured")
                .errorKind(KIND_CONFIG)
                .reason("no effective interval (override absent, stored interval 0)")
                .time(System.currentTimeMillis())
                .build();
    }
}
