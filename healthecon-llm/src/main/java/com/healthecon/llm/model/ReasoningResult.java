package com.healthecon.llm.model;

import lombok.Builder;
import lombok.Value;

/**
 * Successful outcome of an adapter invocation, including how many attempts it took.
 */
@Value
@Builder
public class ReasoningResult {
    String answer;
    String model;
    int attempts;
    long latencyMs;
}
