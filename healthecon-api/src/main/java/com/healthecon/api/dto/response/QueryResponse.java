package com.healthecon.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.healthecon.common.constants.ErrorKind;
import com.healthecon.data.entity.QueryRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {
    private String queryId;
    private String text;
    private List<String> billRefs;
    private String status;
    private String result;
    private ErrorKind errorKind;
    private String errorMessage;
    private Boolean cached;
    private String model;
    private Integer attempts;
    private Instant createdAt;
    private Instant completedAt;
    
    public static QueryResponse from(QueryRecord record, boolean cached) {
        return QueryResponse.builder()
            .queryId(record.getId())
            .text(record.getRawText())
            .billRefs(List.copyOf(record.getContextRefs()))
            .status(record.getStatus().getWireValue())
            .result(record.getResult())
            .errorKind(record.getErrorKind())
            .errorMessage(record.getErrorMessage())
            .cached(cached)
            .model(record.getModel())
            .attempts(record.getAttempts())
            .createdAt(record.getCreatedAt())
            .completedAt(record.getCompletedAt())
            .build();
    }
}
