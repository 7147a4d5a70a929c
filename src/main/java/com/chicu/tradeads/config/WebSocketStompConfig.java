package com.chicu.tradeads.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.*;

@Slf4j
@Configuration
@EnableWebSocketMessageBroker
@RequiredArgsConstructor
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    private final AdsLiveProperties live;

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] origins = live.getAllowedOriginPatterns().toArray(String[]::new);

        // SockJS для браузера, «чистый» WebSocket для STOMP-клиентов
        registry.addEndpoint(live.getEndpoint())
                .setAllowedOriginPatterns(origins)
                .withSockJS();

        registry.addEndpoint(live.getEndpoint())
                .setAllowedOriginPatterns(origins);

        log.info("✅ STOMP endpoint {} (origins={}), события объявлений → {}",
                live.getEndpoint(), live.getAllowedOriginPatterns(), live.getPostedTopic());
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        if (!live.getPostedTopic().startsWith(live.getBrokerPrefix())) {
            throw new IllegalStateException("ads.live.posted-topic " + live.getPostedTopic()
                    + " is not served by broker prefix " + live.getBrokerPrefix());
        }

        config.enableSimpleBroker(live.getBrokerPrefix());
        config.setApplicationDestinationPrefixes(live.getAppPrefix());
    }
}
