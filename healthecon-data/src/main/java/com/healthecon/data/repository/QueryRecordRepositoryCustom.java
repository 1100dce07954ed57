package com.healthecon.data.repository;

import com.healthecon.data.entity.QueryRecord;

import java.time.Instant;
import java.util.List;

public interface QueryRecordRepositoryCustom {
    
    /**
     * Keyset page of history ordered by {@code createdAt DESC, id DESC}.
     * When a cursor is given only rows strictly after it in that order are returned.
     */
    List<QueryRecord> findHistoryPage(QueryHistoryFilter filter, Instant cursorCreatedAt, String cursorId, int limit);
}
