package com.healthecon.llm.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {
    
    @Test
    void shouldUseDefaults() {
        RetryPolicy policy = RetryPolicy.builder().build();
        
        assertThat(policy.getMaxAttempts()).isEqualTo(3);
        assertThat(policy.getAttemptTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.getBaseDelay()).isEqualTo(Duration.ofMillis(500));
    }
    
    @Test
    void shouldDoubleBackoff_untilCapped() {
        RetryPolicy policy = RetryPolicy.builder()
            .baseDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(3))
            .build();
        
        assertThat(policy.backoffMillis(1, 0)).isEqualTo(500);
        assertThat(policy.backoffMillis(2, 0)).isEqualTo(1000);
        assertThat(policy.backoffMillis(3, 0)).isEqualTo(2000);
        assertThat(policy.backoffMillis(4, 0)).isEqualTo(3000);
        assertThat(policy.backoffMillis(40, 0)).isEqualTo(3000);
    }
    
    @Test
    void shouldAddJitterSample() {
        RetryPolicy policy = RetryPolicy.builder().baseDelay(Duration.ofMillis(100)).build();
        
        assertThat(policy.backoffMillis(1, 37)).isEqualTo(137);
        assertThat(policy.backoffMillis(1, -5)).isEqualTo(100);
    }
    
    @Test
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts");
        assertThatThrownBy(() -> RetryPolicy.builder().attemptTimeout(Duration.ZERO).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    void shouldBuildFromProperties() {
        ReasoningProperties properties = new ReasoningProperties();
        properties.setMaxAttempts(5);
        properties.setBaseDelayMs(200);
        properties.setMaxDelayMs(1600);
        properties.setJitterMs(0);
        properties.setTimeoutSeconds(30);
        
        RetryPolicy policy = properties.toRetryPolicy();
        
        assertThat(policy.getMaxAttempts()).isEqualTo(5);
        assertThat(policy.getAttemptTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.backoffMillis(4, 0)).isEqualTo(1600);
    }
}
