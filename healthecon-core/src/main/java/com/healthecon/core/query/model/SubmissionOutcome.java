package com.healthecon.core.query.model;

import com.healthecon.data.entity.QueryRecord;
import lombok.Value;

@Value
public class SubmissionOutcome {
    QueryRecord query;
    Source source;
    
    public boolean isCached() {
        return source == Source.CACHE;
    }
    
    public enum Source {
        /** Served from a completed record inside the cache TTL. */
        CACHE,
        /** This caller led the in-flight call. */
        EXECUTED,
        /** This caller joined a call another submission had started. */
        JOINED
    }
}
