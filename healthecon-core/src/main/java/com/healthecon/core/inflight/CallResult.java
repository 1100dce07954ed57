package com.healthecon.core.inflight;

import com.healthecon.data.entity.QueryRecord;
import lombok.Value;

/**
 * Outcome shared by every waiter of one call.
 */
@Value
public class CallResult {
    QueryRecord query;
    // the call found a stored answer instead of producing one
    boolean reused;

    public static CallResult produced(QueryRecord query) {
        return new CallResult(query, false);
    }

    public static CallResult reused(QueryRecord query) {
        return new CallResult(query, true);
    }
}
