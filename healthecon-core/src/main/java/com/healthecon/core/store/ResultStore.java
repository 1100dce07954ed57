package com.healthecon.core.store;

import com.healthecon.common.constants.QueryStatus;
import com.healthecon.common.exception.QueryNotFoundException;
import com.healthecon.common.exception.StorageException;
import com.healthecon.core.config.QueryEngineProperties;
import com.healthecon.core.fingerprint.Fingerprint;
import com.healthecon.data.entity.QueryRecord;
import com.healthecon.data.repository.QueryHistoryFilter;
import com.healthecon.data.repository.QueryRecordRepository;
import com.healthecon.llm.model.ReasoningResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable record of every query, the fingerprint cache index over completed ones, and paged history.
 * Status changes are conditional single-row updates, so a terminal record is never rewritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResultStore {
    
    private static final List<QueryStatus> OPEN_STATUSES = List.of(QueryStatus.PENDING, QueryStatus.IN_FLIGHT);
    
    private final QueryRecordRepository repository;
    private final QueryEngineProperties properties;
    private final Clock clock;
    
    /**
     * Newest complete record for the fingerprint that is still inside the cache TTL.
     */
    public Optional<QueryRecord> lookup(String fingerprint) {
        Instant since = now().minus(properties.getCache().getTtl());
        Optional<QueryRecord> hit = storage("lookup", () ->
            repository.findFirstByFingerprintAndStatusAndCompletedAtGreaterThanEqualOrderByCompletedAtDesc(
                fingerprint, QueryStatus.COMPLETE, since));
        
        if (hit.isPresent()) {
            log.info("[STORE] Cache hit | fingerprint={} | queryId={} | completedAt={}",
                abbreviate(fingerprint), hit.get().getId(), hit.get().getCompletedAt());
        } else {
            log.debug("[STORE] Cache miss | fingerprint={} | since={}", abbreviate(fingerprint), since);
        }
        return hit;
    }
    
    public QueryRecord create(Fingerprint fingerprint, String rawText) {
        QueryRecord record = QueryRecord.builder()
            .rawText(rawText)
            .normalizedText(fingerprint.getNormalizedText())
            .contextRefs(new ArrayList<>(fingerprint.getSortedRefs()))
            .fingerprint(fingerprint.getValue())
            .status(QueryStatus.PENDING)
            .createdAt(now())
            .build();
        
        QueryRecord saved = storage("create", () -> repository.save(record));
        log.info("[STORE] Query created | queryId={} | fingerprint={} | contextRefs={}",
            saved.getId(), fingerprint.shortValue(), saved.getContextRefs().size());
        return saved;
    }
    
    public QueryRecord markInFlight(String id) {
        int updated = storage("markInFlight", () ->
            repository.markInFlight(id, now(), QueryStatus.PENDING, QueryStatus.IN_FLIGHT));
        if (updated == 0) {
            log.warn("[STORE] Query not pending, inFlight transition skipped | queryId={}", id);
        }
        return get(id);
    }
    
    public QueryRecord complete(String id, ReasoningResult result) {
        return complete(id, result.getAnswer(), result.getModel(), result.getAttempts());
    }
    
    /**
     * Records the answer. Calling it on a terminal record returns that record unchanged.
     */
    public QueryRecord complete(String id, String answer, String model, int attempts) {
        int updated = storage("complete", () ->
            repository.markComplete(id, answer, model, attempts, now(), OPEN_STATUSES, QueryStatus.COMPLETE));
        QueryRecord record = get(id);
        if (updated == 0) {
            log.debug("[STORE] Query already terminal, complete ignored | queryId={} | status={}", id, record.getStatus());
        } else {
            log.info("[STORE] Query completed | queryId={} | model={} | attempts={}", id, model, attempts);
        }
        return record;
    }
    
    /**
     * Records the failure. Calling it on a terminal record returns that record unchanged.
     */
    public QueryRecord fail(String id, ErrorInfo error, int attempts) {
        int updated = storage("fail", () ->
            repository.markFailed(id, error.getKind(), error.getMessage(), attempts, now(), OPEN_STATUSES, QueryStatus.FAILED));
        QueryRecord record = get(id);
        if (updated == 0) {
            log.debug("[STORE] Query already terminal, fail ignored | queryId={} | status={}", id, record.getStatus());
        } else {
            log.warn("[STORE] Query failed | queryId={} | kind={} | attempts={}", id, error.getKind(), attempts);
        }
        return record;
    }
    
    public QueryRecord get(String id) {
        return storage("get", () -> repository.findById(id))
            .orElseThrow(() -> new QueryNotFoundException(id));
    }
    
    /**
     * Keyset-paged history ordered by (createdAt, id) descending.
     * The token is the cursor returned with the previous page; null starts from the newest record.
     */
    public HistoryPage history(QueryHistoryFilter filter, String pageToken, Integer pageSize) {
        int size = clampPageSize(pageSize);
        PageToken cursor = pageToken == null || pageToken.isBlank() ? null : PageToken.decode(pageToken);
        
        // One extra row tells whether another page exists
        List<QueryRecord> rows = storage("history", () -> repository.findHistoryPage(
            filter != null ? filter : QueryHistoryFilter.none(),
            cursor != null ? cursor.getCreatedAt() : null,
            cursor != null ? cursor.getId() : null,
            size + 1));
        
        boolean more = rows.size() > size;
        List<QueryRecord> page = more ? List.copyOf(rows.subList(0, size)) : List.copyOf(rows);
        String next = null;
        if (more) {
            QueryRecord last = page.get(page.size() - 1);
            next = new PageToken(last.getCreatedAt(), last.getId()).encode();
        }
        
        log.debug("[STORE] History page | filter={} | pageSize={} | returned={} | hasMore={}",
            filter, size, page.size(), more);
        return new HistoryPage(page, next);
    }
    
    public Map<QueryStatus, Long> countByStatus() {
        Map<QueryStatus, Long> counts = new EnumMap<>(QueryStatus.class);
        for (QueryStatus status : QueryStatus.values()) {
            counts.put(status, 0L);
        }
        List<Object[]> rows = storage("countByStatus", repository::countGroupedByStatus);
        for (Object[] row : rows) {
            counts.put((QueryStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
    
    public long count() {
        return storage("count", repository::count);
    }
    
    int clampPageSize(Integer requested) {
        int max = Math.max(1, properties.getHistory().getMaxPageSize());
        int size = requested != null ? requested : properties.getHistory().getDefaultPageSize();
        return Math.max(1, Math.min(size, max));
    }
    
    private Instant now() {
        // Database timestamps keep microseconds
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
    
    private <T> T storage(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("[STORE] Storage operation failed | operation={} | error={}", operation, e.getMessage());
            throw new StorageException("Query store unavailable during " + operation, e);
        }
    }
    
    private static String abbreviate(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }
}
