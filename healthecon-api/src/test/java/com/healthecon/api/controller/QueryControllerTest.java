package com.healthecon.api.controller;

import com.healthecon.api.exception.GlobalExceptionHandler;
import com.healthecon.common.constants.ErrorKind;
import com.healthecon.common.constants.QueryStatus;
import com.healthecon.common.exception.QueryNotFoundException;
import com.healthecon.common.exception.StorageException;
import com.healthecon.common.exception.ValidationException;
import com.healthecon.core.query.QueryOrchestrator;
import com.healthecon.core.query.model.SubmissionOutcome;
import com.healthecon.core.query.model.SubmissionOutcome.Source;
import com.healthecon.core.store.HistoryPage;
import com.healthecon.core.store.ResultStore;
import com.healthecon.data.entity.QueryRecord;
import com.healthecon.data.repository.QueryHistoryFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class QueryControllerTest {
    
    private static final Instant CREATED = Instant.parse("2026-03-01T09:00:00Z");
    
    @Mock
    private QueryOrchestrator queryOrchestrator;
    
    @Mock
    private ResultStore resultStore;
    
    private MockMvc mockMvc;
    
    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new QueryController(queryOrchestrator, resultStore))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }
    
    @Test
    void shouldReturnCompletedQuery() throws Exception {
        QueryRecord record = record("q-1", QueryStatus.COMPLETE)
            .result("NICE uses GBP 20,000 to 30,000 per QALY.")
            .model("gpt-4o")
            .completedAt(CREATED.plusSeconds(4))
            .build();
        when(queryOrchestrator.submit(eq("What is the QALY threshold?"), eq(List.of("bill-1"))))
            .thenReturn(new SubmissionOutcome(record, Source.EXECUTED));
        
        mockMvc.perform(post("/api/v1/queries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"What is the QALY threshold?\", \"billRefs\": [\"bill-1\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.queryId").value("q-1"))
            .andExpect(jsonPath("$.status").value("complete"))
            .andExpect(jsonPath("$.result").value("NICE uses GBP 20,000 to 30,000 per QALY."))
            .andExpect(jsonPath("$.cached").value(false))
            .andExpect(jsonPath("$.createdAt").exists())
            .andExpect(jsonPath("$.completedAt").exists())
            .andExpect(jsonPath("$.errorKind").doesNotExist());
    }
    
    @Test
    void shouldFlagCachedAnswers() throws Exception {
        QueryRecord record = record("q-1", QueryStatus.COMPLETE).result("cached answer").completedAt(CREATED).build();
        when(queryOrchestrator.submit(any(), any())).thenReturn(new SubmissionOutcome(record, Source.CACHE));
        
        mockMvc.perform(post("/api/v1/queries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"What is the QALY threshold?\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cached").value(true));
    }
    
    @Test
    void shouldReturnFailedQueryWithOk() throws Exception {
        QueryRecord record = record("q-2", QueryStatus.FAILED)
            .errorKind(ErrorKind.RETRIES_EXHAUSTED)
            .errorMessage("Reasoning service still failing after 3 attempts")
            .attempts(3)
            .completedAt(CREATED.plusSeconds(30))
            .build();
        when(queryOrchestrator.submit(any(), any())).thenReturn(new SubmissionOutcome(record, Source.EXECUTED));
        
        mockMvc.perform(post("/api/v1/queries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"Cost per DALY of bed nets\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("failed"))
            .andExpect(jsonPath("$.errorKind").value("RETRIES_EXHAUSTED"))
            .andExpect(jsonPath("$.attempts").value(3))
            .andExpect(jsonPath("$.result").doesNotExist());
    }
    
    @Test
    void shouldRejectBlankText() throws Exception {
        mockMvc.perform(post("/api/v1/queries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"   \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.message").value("Validation failed"));
        
        verifyNoInteractions(queryOrchestrator);
    }
    
    @Test
    void shouldMapUnknownBillToBadRequest() throws Exception {
        when(queryOrchestrator.submit(any(), anyList()))
            .thenThrow(new ValidationException("Unknown bill references: [bill-x]"));
        
        mockMvc.perform(post("/api/v1/queries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"Is this bill fair?\", \"billRefs\": [\"bill-x\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown bill references: [bill-x]"))
            .andExpect(jsonPath("$.path").value("/api/v1/queries"));
    }
    
    @Test
    void shouldMapStorageFailureToServiceUnavailable() throws Exception {
        when(queryOrchestrator.submit(any(), any()))
            .thenThrow(new StorageException("Query store unavailable during create", new RuntimeException("db down")));
        
        mockMvc.perform(post("/api/v1/queries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"ICER of statins\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value(503));
    }
    
    @Test
    void shouldListHistoryWithFiltersAndCursor() throws Exception {
        QueryRecord record = record("q-3", QueryStatus.COMPLETE).result("answer").completedAt(CREATED).build();
        when(resultStore.history(any(), eq("cursor-1"), eq(5)))
            .thenReturn(new HistoryPage(List.of(record), "cursor-2"));
        
        mockMvc.perform(get("/api/v1/queries")
                .param("status", "complete")
                .param("billId", "bill-1")
                .param("from", "2026-03-01T00:00:00Z")
                .param("to", "2026-03-02T00:00:00Z")
                .param("pageToken", "cursor-1")
                .param("pageSize", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.queries[0].queryId").value("q-3"))
            .andExpect(jsonPath("$.nextPageToken").value("cursor-2"));
        
        ArgumentCaptor<QueryHistoryFilter> filter = ArgumentCaptor.forClass(QueryHistoryFilter.class);
        verify(resultStore).history(filter.capture(), eq("cursor-1"), eq(5));
        assertThat(filter.getValue().getStatus()).isEqualTo(QueryStatus.COMPLETE);
        assertThat(filter.getValue().getBillId()).isEqualTo("bill-1");
        assertThat(filter.getValue().getFrom()).isEqualTo(Instant.parse("2026-03-01T00:00:00Z"));
        assertThat(filter.getValue().getTo()).isEqualTo(Instant.parse("2026-03-02T00:00:00Z"));
    }
    
    @Test
    void shouldOmitNextPageToken_onLastPage() throws Exception {
        when(resultStore.history(any(), isNull(), isNull())).thenReturn(new HistoryPage(List.of(), null));
        
        mockMvc.perform(get("/api/v1/queries"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.queries").isEmpty())
            .andExpect(jsonPath("$.nextPageToken").doesNotExist());
    }
    
    @Test
    void shouldRejectUnknownStatusFilter() throws Exception {
        mockMvc.perform(get("/api/v1/queries").param("status", "archived"))
            .andExpect(status().isBadRequest());
        
        verifyNoInteractions(resultStore);
    }
    
    @Test
    void shouldReturnNotFound_forUnknownQuery() throws Exception {
        when(resultStore.get("missing")).thenThrow(new QueryNotFoundException("missing"));
        
        mockMvc.perform(get("/api/v1/queries/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Query not found: missing"));
    }
    
    private static QueryRecord.QueryRecordBuilder record(String id, QueryStatus status) {
        return QueryRecord.builder()
            .id(id)
            .rawText("What is the QALY threshold?")
            .normalizedText("what is the qaly threshold?")
            .contextRefs(List.of("bill-1"))
            .fingerprint("ab".repeat(32))
            .status(status)
            .attempts(1)
            .createdAt(CREATED);
    }
}
