package com.lumen.query.resilience;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ResilienceProperties.class)
public class ResilienceConfig {

    @Bean
    public ResilienceRegistry resilienceRegistry(ResilienceProperties properties, MeterRegistry meterRegistry, Clock clock) {
        return new ResilienceRegistry(properties, meterRegistry, clock);
    }
}
