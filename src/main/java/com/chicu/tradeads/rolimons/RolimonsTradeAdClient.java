package com.chicu.tradeads.rolimons;

import com.chicu.tradeads.config.RolimonsProperties;
import com.chicu.tradeads.engine.AdJob;
import com.chicu.tradeads.engine.PostOutcome;
import com.chicu.tradeads.engine.PostResultClassifier;
import com.chicu.tradeads.engine.TradeAdPoster;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Публикация объявления в Rolimons API.
 *
 * Вызов асинхронный (OkHttp enqueue): поток планировщика не ждёт сеть.
 * Cookie отправляется только одна: _RoliVerification.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RolimonsTradeAdClient implements TradeAdPoster {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final RolimonsProperties props;

    private OkHttpClient clientWithTimeouts() {
        return baseClient.newBuilder()
                .callTimeout(Duration.ofMillis(Math.max(1000, props.getCallTimeoutMs())))
                .build();
    }

    @Override
    public CompletableFuture<PostOutcome> post(AdJob job) {
        if (!job.hasCredential()) {
            return CompletableFuture.completedFuture(PostOutcome.skipped());
        }

        CompletableFuture<PostOutcome> result = new CompletableFuture<>();
        Request request = buildRequest(job);

        log.debug("📤 POST {} ad={} player={}", request.url(), job.id(), job.playerId());

        clientWithTimeouts().newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.debug("Rolimons call failed for ad {}: {}", job.id(), e.getMessage());
                result.complete(PostResultClassifier.transportFailure(e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    String body = response.body() != null ? response.body().string() : "";
                    result.complete(PostResultClassifier.classify(response.code(), body));
                } catch (IOException e) {
                    result.complete(PostResultClassifier.transportFailure(e));
                }
            }
        });

        return result;
    }

    Request buildRequest(AdJob job) {
        String url = props.getBaseUrl().replaceAll("/+$", "") + props.getCreateAdPath();

        return new Request.Builder()
                .url(url)
                .post(RequestBody.create(payloadJson(job), JSON))
                .header("User-Agent", props.getUserAgent())
                .header("Accept", "application/json, text/plain, */*")
                .header("Accept-Language", "en-US,en;q=0.9")
                .header("Origin", props.getOrigin())
                .header("Referer", props.getReferer())
                .header("Cookie", "_RoliVerification=" + job.roliVerification().trim())
                .build();
    }

    private String payloadJson(AdJob job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("player_id", job.playerId());
        payload.put("offer_item_ids", job.offerItemIds());
        payload.put("request_item_ids", job.requestItemIds());
        payload.put("request_tags", job.requestTags().stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .toList());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize trade ad payload: " + job.id(), e);
        }
    }
}
