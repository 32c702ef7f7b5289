package com.liquidation.auctionengine.infra.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
