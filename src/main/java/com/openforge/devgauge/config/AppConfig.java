package com.openforge.devgauge.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.devgauge.memory.MemoryProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.concurrent.DelegatingSecurityContextExecutorService;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - Java HttpClient          the only HTTP engine for model calls
 *  - Jackson ObjectMapper     snake_case JSON, ISO dates, tolerant deserialization
 *  - Clock                    UTC; swapped for a fixed clock in tests
 *  - extraction executor      background memory extraction after a session ends
 */
@Configuration
public class AppConfig {

    /**
     * Single shared HttpClient. Per-request read timeouts are set by LlmClient.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper for the provider API, the REST surface and the JSON
     * columns alike.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs memory extraction off the request thread. Wrapped so the task sees
     * the security context of the request that ended the session; the memory
     * store checks ownership against it.
     */
    @Bean(name = "memoryExtractionExecutor", destroyMethod = "shutdown")
    public ExecutorService memoryExtractionExecutor(MemoryProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "memory-extraction-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, properties.extractionThreads()), threads);
        return new DelegatingSecurityContextExecutorService(pool);
    }
}
