package com.healthecon.core.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class QueryEngineConfig {
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    /**
     * Runs leader work for the inflight coordinator. No request thread owns these threads,
     * so an external call keeps running after every waiter has gone away.
     */
    @Bean(name = "inflightExecutor", destroyMethod = "shutdown")
    public ExecutorService inflightExecutor(QueryEngineProperties properties) {
        int threads = Math.max(1, properties.getEngine().getExecutorThreads());
        AtomicInteger counter = new AtomicInteger();
        log.info("[ENGINE] Creating inflight executor | threads={}", threads);
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "inflight-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
