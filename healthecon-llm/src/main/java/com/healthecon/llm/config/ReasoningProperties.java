package com.healthecon.llm.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "reasoning")
@Getter
@Setter
public class ReasoningProperties {
    private String apiKey;
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o";
    private int maxOutputTokens = 4096;
    private int maxAttempts = 3;
    private long baseDelayMs = 500;
    private long maxDelayMs = 8000;
    private long jitterMs = 250;
    private int timeoutSeconds = 60;
    
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
    
    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .baseDelay(Duration.ofMillis(baseDelayMs))
            .maxDelay(Duration.ofMillis(maxDelayMs))
            .jitter(Duration.ofMillis(jitterMs))
            .attemptTimeout(Duration.ofSeconds(timeoutSeconds))
            .build();
    }
}
