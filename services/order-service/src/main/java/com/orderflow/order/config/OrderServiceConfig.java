package com.orderflow.order.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OrderServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
