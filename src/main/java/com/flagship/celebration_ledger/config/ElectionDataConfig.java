package com.flagship.celebration_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.celebration_ledger.election.DefaultElectionDateTable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for election date lookups: HTTP client, the bounded executor that
 * runs live lookups, and the default table.
 */
@Configuration
public class ElectionDataConfig {

    @Value("${election.live-source.timeout:2s}")
    private Duration liveTimeout;

    @Value("${election.live-source.threads:4}")
    private int lookupThreads;

    @Value("${election.defaults-resource:election/default-election-dates.json}")
    private String defaultsResource;

    @Bean
    public RestTemplate electionRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(liveTimeout)
                .setReadTimeout(liveTimeout)
                .build();
    }

    @Bean(name = "electionLookupExecutor", destroyMethod = "shutdownNow")
    public ExecutorService electionLookupExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(lookupThreads, runnable -> {
            Thread thread = new Thread(runnable, "election-lookup-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public DefaultElectionDateTable defaultElectionDateTable(ObjectMapper objectMapper) {
        return DefaultElectionDateTable.fromClasspath(defaultsResource, objectMapper);
    }
}
