package com.healthecon.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitQueryRequest {
    
    @NotBlank(message = "Query text is required")
    private String text;
    
    // Ids of uploaded bills the question refers to
    private List<String> billRefs = new ArrayList<>();
}
