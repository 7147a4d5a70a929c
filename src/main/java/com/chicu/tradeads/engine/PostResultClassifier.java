package com.chicu.tradeads.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Locale;

/**
 * Разбор ответа API публикации в {@link PostOutcome}.
 *
 * Порядок: сетевая ошибка → verification → прочая ошибка API → успех.
 * Verification выделяется отдельно: только на неё UI предлагает обновить cookie.
 * Код ошибки из JSON прикладывается как диагностика и на классификацию не влияет.
 */
public final class PostResultClassifier {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final List<String> VERIFICATION_MARKERS = List.of(
            "verification",
            "roli_verification",
            "invalid token",
            "not authenticated"
    );

    private PostResultClassifier() {
    }

    public static PostOutcome classify(int status, String body) {
        String text = body == null ? "" : body;

        if (status >= 200 && status < 300) {
            return PostOutcome.success(status);
        }

        Long code = extractErrorCode(text);

        if (isVerificationRelated(status, text)) {
            return new PostOutcome(PostOutcomeKind.VERIFICATION, status,
                    "verification_required: " + status + " - " + shrink(text), code);
        }

        return new PostOutcome(PostOutcomeKind.API_ERROR, status,
                "Failed to post trade ad: " + status + " - " + shrink(text), code);
    }

    public static PostOutcome transportFailure(Throwable error) {
        String msg;
        if (error == null) {
            msg = "request did not complete";
        } else if (error.getMessage() != null && !error.getMessage().isBlank()) {
            msg = error.getMessage();
        } else {
            msg = error.getClass().getSimpleName();
        }
        return new PostOutcome(PostOutcomeKind.NETWORK_ERROR, null, msg, null);
    }

    static boolean isVerificationRelated(int status, String body) {
        if (status == 401 || status == 403) {
            return true;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return VERIFICATION_MARKERS.stream().anyMatch(lower::contains);
    }

    static Long extractErrorCode(String body) {
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            JsonNode code = JSON.readTree(trimmed).get("code");
            if (code != null && code.canConvertToLong() && code.isIntegralNumber()) {
                return code.asLong();
            }
        } catch (Exception e) {
            // тело похоже на JSON, но не разобралось: кода просто нет
            return null;
        }
        return null;
    }

    private static String shrink(String s) {
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
