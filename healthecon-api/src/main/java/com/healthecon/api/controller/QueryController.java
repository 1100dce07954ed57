package com.healthecon.api.controller;

import com.healthecon.api.dto.request.SubmitQueryRequest;
import com.healthecon.api.dto.response.HistoryResponse;
import com.healthecon.api.dto.response.QueryResponse;
import com.healthecon.common.constants.QueryStatus;
import com.healthecon.common.exception.ValidationException;
import com.healthecon.core.query.QueryOrchestrator;
import com.healthecon.core.query.model.SubmissionOutcome;
import com.healthecon.core.store.HistoryPage;
import com.healthecon.core.store.ResultStore;
import com.healthecon.data.repository.QueryHistoryFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/queries")
@RequiredArgsConstructor
@Slf4j
public class QueryController {
    
    private final QueryOrchestrator queryOrchestrator;
    private final ResultStore resultStore;
    
    /**
     * Answers a research question. A failed external call still yields 200 with status {@code failed}.
     */
    @PostMapping
    public ResponseEntity<QueryResponse> submit(@Valid @RequestBody SubmitQueryRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("[API] Query submitted | textLength={} | billRefs={}",
            request.getText().length(), request.getBillRefs() != null ? request.getBillRefs().size() : 0);
        
        SubmissionOutcome outcome = queryOrchestrator.submit(request.getText(), request.getBillRefs());
        
        log.info("[API] Query answered | queryId={} | status={} | source={} | durationMs={}",
            outcome.getQuery().getId(), outcome.getQuery().getStatus(), outcome.getSource(),
            System.currentTimeMillis() - startTime);
        return ResponseEntity.ok(QueryResponse.from(outcome.getQuery(), outcome.isCached()));
    }
    
    @GetMapping
    public ResponseEntity<HistoryResponse> history(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String billId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String pageToken,
            @RequestParam(required = false) Integer pageSize
    ) {
        QueryHistoryFilter filter = QueryHistoryFilter.builder()
            .status(parseStatus(status))
            .billId(billId == null || billId.isBlank() ? null : billId.trim())
            .from(from)
            .to(to)
            .build();
        
        HistoryPage page = resultStore.history(filter, pageToken, pageSize);
        
        return ResponseEntity.ok(HistoryResponse.builder()
            .queries(page.getQueries().stream().map(record -> QueryResponse.from(record, false)).toList())
            .nextPageToken(page.getNextPageToken())
            .build());
    }
    
    @GetMapping("/{queryId}")
    public ResponseEntity<QueryResponse> get(@PathVariable String queryId) {
        return ResponseEntity.ok(QueryResponse.from(resultStore.get(queryId), false));
    }
    
    private static QueryStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return QueryStatus.fromString(status.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }
}
