package com.williamcallahan.lawlens.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires the HTTP client for the document back end and the scheduler that drives fetch timeouts.
 */
@Configuration
public class RetrievalClientConfig {

    @Bean
    public WebClient sectionRetrievalWebClient(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        return webClientBuilder
                .baseUrl(appProperties.getRetrieval().getBaseUrl())
                .build();
    }

    /**
     * Timer source for fetch timeouts; tests substitute a virtual-time scheduler.
     *
     * @return parallel scheduler
     */
    @Bean
    public Scheduler retrievalTimeoutScheduler() {
        return Schedulers.parallel();
    }
}
