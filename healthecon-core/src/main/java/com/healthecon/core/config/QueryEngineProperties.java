package com.healthecon.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "query")
@Getter
@Setter
public class QueryEngineProperties {
    
    private Cache cache = new Cache();
    private History history = new History();
    private Engine engine = new Engine();
    
    @Getter
    @Setter
    public static class Cache {
        // Completed answers older than this are not served, but stay in history
        private Duration ttl = Duration.ofHours(24);
    }
    
    @Getter
    @Setter
    public static class History {
        private int defaultPageSize = 10;
        private int maxPageSize = 100;
    }
    
    @Getter
    @Setter
    public static class Engine {
        private int executorThreads = 16;
    }
}
