package com.healthecon.llm.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReasoningRequest {
    String text;
    @Singular
    List<ContextDocument> contextDocuments;
    
    /**
     * A bill attached to the question, passed to the model as reference material.
     */
    @Value
    @Builder
    public static class ContextDocument {
        String id;
        String fileName;
        String summary;
    }
}
