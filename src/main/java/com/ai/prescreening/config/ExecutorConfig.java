package com.ai.prescreening.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure: the pool for fire-and-forget side effects and the calendar HTTP client.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "backgroundExecutor", destroyMethod = "shutdown")
    public ExecutorService backgroundExecutor(@Value("${background.pool-size:4}") int poolSize) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "background-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** One client for all calls; RestTemplate is safe for concurrent use. */
    @Bean(name = "schedulingRestTemplate")
    public RestTemplate schedulingRestTemplate(RestTemplateBuilder builder,
                                               @Value("${scheduling.connect-timeout:5s}") Duration connectTimeout,
                                               @Value("${scheduling.read-timeout:10s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
