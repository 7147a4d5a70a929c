package com.chicu.tradeads.config;

import com.chicu.tradeads.engine.ExecutorAdTimer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        AdsSchedulerProperties.class,
        AdsLiveProperties.class,
        RolimonsProperties.class
})
public class AdsConfig {

    /**
     * Общий таймер циклов публикации. Останавливается вместе с контекстом.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorAdTimer adTimer(AdsSchedulerProperties props) {
        return new ExecutorAdTimer(props.getPoolSize());
    }
}
