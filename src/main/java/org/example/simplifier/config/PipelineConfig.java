package org.example.simplifier.config;

import org.example.simplifier.service.gateway.FallbackPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    @Bean
    public FallbackPolicy fallbackPolicy(RewriteProperties properties) {
        return new FallbackPolicy(properties.getSummary().getFallbackChars());
    }
}
