package com.chicu.tradeads.engine;

/**
 * Классифицированный результат публикации.
 *
 * @param status    HTTP-статус, null если запрос не дошёл
 * @param reason    диагностический текст (для ошибок)
 * @param errorCode код ошибки из JSON-ответа, если удалось вытащить
 */
public record PostOutcome(
        PostOutcomeKind kind,
        Integer status,
        String reason,
        Long errorCode
) {

    public static PostOutcome success(int status) {
        return new PostOutcome(PostOutcomeKind.SUCCESS, status, null, null);
    }

    public static PostOutcome skipped() {
        return new PostOutcome(PostOutcomeKind.SKIPPED, null, "no roli_verification", null);
    }

    public boolean isSuccess() {
        return kind == PostOutcomeKind.SUCCESS;
    }
}
