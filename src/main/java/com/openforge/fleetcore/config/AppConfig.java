package com.openforge.fleetcore.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.fleetcore.research.ResearchProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Core infrastructure beans:
 *  - researchExecutor → runs research loops off the request thread, bounded by agent.research
 *  - Java HttpClient  → the only HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → Java time support, tolerant deserialization
 *
 * Property names stay camelCase on the REST surface. The search provider's
 * snake_case wire records declare their own naming strategy.
 */
@Configuration
public class AppConfig {

    /**
     * Named "researchExecutor" so it does not collide with Spring Boot's
     * auto-configured "applicationTaskExecutor". Injected explicitly where needed.
     *
     * At most max-concurrent-runs loops execute at once and queue-capacity more
     * wait; further submissions are rejected with RejectedExecutionException.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService researchExecutor(ResearchProperties properties) {
        int threads = Math.max(1, properties.maxConcurrentRuns());
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                threads, threads,
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, properties.queueCapacity())),
                new CustomizableThreadFactory("research-"),
                new ThreadPoolExecutor.AbortPolicy());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Single, shared HttpClient instance. 10 s connect timeout; per-request
     * read timeouts are set by the caller.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
