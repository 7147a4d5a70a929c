package com.chicu.tradeads;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.tradeads")
public class TradeAdsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeAdsApplication.class, args);
    }
}
