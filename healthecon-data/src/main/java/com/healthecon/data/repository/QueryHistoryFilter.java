package com.healthecon.data.repository;

import com.healthecon.common.constants.QueryStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * History filter. Every field is optional; {@code from} is inclusive, {@code to} exclusive.
 */
@Value
@Builder
public class QueryHistoryFilter {
    Instant from;
    Instant to;
    String billId;
    QueryStatus status;
    
    public static QueryHistoryFilter none() {
        return QueryHistoryFilter.builder().build();
    }
}
