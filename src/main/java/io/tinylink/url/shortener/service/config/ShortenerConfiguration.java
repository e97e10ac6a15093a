package io.tinylink.url.shortener.service.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ShortenerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
