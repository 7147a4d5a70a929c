package com.chicu.tradeads.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ads.scheduler")
public class AdsSchedulerProperties {

    /**
     * Потоки общего таймера. Циклы объявлений потоками не владеют.
     */
    private int poolSize = 2;

    /**
     * Пауза после пропуска/ошибки, если у объявления нет интервала.
     */
    private int fallbackRetryMinutes = 20;

    /**
     * Минимальный интервал (override или сохранённый; 0 в сохранённом = наследовать).
     */
    private int minIntervalMinutes = 15;

    /**
     * Сколько последних событий держать для REST.
     */
    private int recentEvents = 200;
}
