package com.dailyprojects.core.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock(EngineProperties properties) {
        return Clock.system(properties.getZone());
    }
}
