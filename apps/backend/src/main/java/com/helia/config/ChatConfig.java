package com.helia.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({ChatProperties.class, PersonaProperties.class, AuthProperties.class})
public class ChatConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
