package com.aiinpocket.choretrust.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 所有服務都從這個 Clock 取得目前時間，測試時以可調整的 Clock 取代。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
