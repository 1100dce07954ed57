package com.healthecon.core.store;

import com.healthecon.data.entity.QueryRecord;
import lombok.Value;

import java.util.List;

/**
 * One page of history, newest first. {@code nextPageToken} is null on the last page.
 */
@Value
public class HistoryPage {
    List<QueryRecord> queries;
    String nextPageToken;
    
    public boolean hasMore() {
        return nextPageToken != null;
    }
}
