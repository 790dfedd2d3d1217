package com.example.doctalk.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;

@Configuration
public class RateLimitConfig {

    @Bean
    public RedisScript<String> slidingWindowScript() {
        return RedisScript.of(new ClassPathResource("scripts/sliding_window.lua"), String.class);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
