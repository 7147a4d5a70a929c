package com.chicu.tradeads.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "rolimons")
public class RolimonsProperties {

    private String baseUrl = "https://api.rolimons.com";

    private String createAdPath = "/tradeads/v1/createad";

    /**
     * API ждёт «браузерные» заголовки, иначе отвечает 403.
     */
    private String origin = "https://www.rolimons.com";
    private String referer = "https://www.rolimons.com/tradeads";
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/118.0.0.0 Safari/537.36";

    private long connectTimeoutMs = 5_000;
    private long readTimeoutMs = 10_000;

    /**
     * Общий лимит на весь вызов; поверх него цикл объявления ничего не ждёт.
     */
    private long callTimeoutMs = 10_000;

    /**
     * Сколько публикаций могут идти к API одновременно (OkHttp maxRequestsPerHost).
     */
    private int maxConcurrentPosts = 16;
}
