package com.whereq.poolstat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the pool query gateway
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient poolQueryWebClient(WebClient.Builder webClientBuilder, PoolStatProperties properties) {
        return webClientBuilder
            .baseUrl(properties.getQuery().getGatewayUrl())
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(64 * 1024 * 1024)) // 64MB, large schedd queues
            .build();
    }
}
