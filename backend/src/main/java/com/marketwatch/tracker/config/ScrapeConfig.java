package com.marketwatch.tracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ScrapeConfig {

    @Bean(name = "adapterExecutor", destroyMethod = "shutdownNow")
    public ExecutorService adapterExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getGlobalConcurrency(), namedThreads("scrape-adapter"));
    }

    @Bean(name = "searchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getSearchConcurrency(), namedThreads("scrape-search"));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size, namedThreads("scrape-http"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
