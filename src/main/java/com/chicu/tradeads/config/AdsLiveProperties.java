package com.chicu.tradeads.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "ads.live")
public class AdsLiveProperties {

    /**
     * STOMP endpoint для UI. Регистрируется дважды: с SockJS и как «чистый» WebSocket.
     */
    private String endpoint = "/ws/ads";

    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

    /** Префикс simple broker */
    private String brokerPrefix = "/topic";

    /** Префикс @MessageMapping */
    private String appPrefix = "/app";

    /**
     * Куда уходят события циклов. Должен лежать под brokerPrefix.
     */
    private String postedTopic = "/topic/ads/posted";
}
