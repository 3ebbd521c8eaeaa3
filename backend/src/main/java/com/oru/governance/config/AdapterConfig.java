package com.oru.governance.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Infrastructure shared by the adapters and the query planner.
 */
@Configuration
public class AdapterConfig {

    @Value("${governance.metrics.executor.pool-size:16}")
    private int poolSize;

    @Value("${governance.metrics.executor.queue-capacity:1000}")
    private int queueCapacity;

    @Value("${kubernetes.connect-timeout:5s}")
    private Duration kubernetesConnectTimeout;

    @Value("${kubernetes.read-timeout:30s}")
    private Duration kubernetesReadTimeout;

    @Value("${prometheus.connect-timeout:5s}")
    private Duration prometheusConnectTimeout;

    @Value("${prometheus.read-timeout:60s}")
    private Duration prometheusReadTimeout;

    @Bean
    public RestTemplate kubernetesRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(kubernetesConnectTimeout)
                .setReadTimeout(kubernetesReadTimeout)
                .build();
    }

    @Bean
    public RestTemplate prometheusRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(prometheusConnectTimeout)
                .setReadTimeout(prometheusReadTimeout)
                .build();
    }

    /**
     * Fixed-size pool shared by every report; per-batch fairness comes from
     * the planner's semaphore, not from this pool.
     */
    @Bean
    public ThreadPoolTaskExecutor metricQueryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("metric-query-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
