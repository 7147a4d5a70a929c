package com.chicu.tradeads.config;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
public class HttpClientConfig {

    /**
     * 🌐 Общий OkHttpClient для публикаций.
     * Все объявления бьют в один хост, поэтому лимит per-host поднят до числа
     * одновременных постов. Повтор POST при обрыве выключен: он может задублировать объявление.
     */
    @Bean
    public OkHttpClient okHttpClient(RolimonsProperties props) {
        Dispatcher dispatcher = new Dispatcher();
        int concurrent = Math.max(1, props.getMaxConcurrentPosts());
        dispatcher.setMaxRequests(Math.max(concurrent, dispatcher.getMaxRequests()));
        dispatcher.setMaxRequestsPerHost(concurrent);

        log.info("🌐 OkHttp: maxRequestsPerHost={}, connectTimeout={}ms, readTimeout={}ms",
                concurrent, props.getConnectTimeoutMs(), props.getReadTimeoutMs());

        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(props.getReadTimeoutMs()))
                .writeTimeout(Duration.ofMillis(props.getReadTimeoutMs()))
                .retryOnConnectionFailure(false)
                .build();
    }
}
