package com.healthecon.llm.model;

import lombok.Value;

@Value
public class ReasoningResponse {
    String answer;
    String model;
}
