package com.healthecon.core.service;

import com.healthecon.common.constants.ErrorKind;
import com.healthecon.core.processor.BillContentReader;
import com.healthecon.llm.model.BillContent;
import com.healthecon.llm.model.ReasoningResult;
import com.healthecon.llm.service.ExternalServiceException;
import com.healthecon.llm.service.ReasoningClientAdapter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BillSummarizerTest {
    
    private static final Path FILE = Path.of("bills", "bill-1.pdf");
    private static final BillContent CONTENT = BillContent.builder()
        .billId("bill-1")
        .mediaType("image/png")
        .data(new byte[]{1})
        .build();
    
    @Mock
    private BillContentReader contentReader;
    
    @Mock
    private ReasoningClientAdapter reasoningAdapter;
    
    @InjectMocks
    private BillSummarizer summarizer;
    
    @Test
    void shouldReturnSummary_fromReasoningService() throws IOException {
        when(reasoningAdapter.isConfigured()).thenReturn(true);
        when(contentReader.read("bill-1", "pdf", FILE)).thenReturn(CONTENT);
        when(reasoningAdapter.summarizeBill(CONTENT)).thenReturn(ReasoningResult.builder()
            .answer("Vendor: Royal Infirmary. Total: GBP 3,410. Date: 2026-02-11. Items: CT scan, bed days.")
            .model("gpt-4o")
            .attempts(1)
            .build());
        
        assertThat(summarizer.summarize("bill-1", "pdf", FILE))
            .hasValueSatisfying(summary -> assertThat(summary).contains("Royal Infirmary"));
    }
    
    @Test
    void shouldReturnEmpty_whenReasoningServiceFails() throws IOException {
        when(reasoningAdapter.isConfigured()).thenReturn(true);
        when(contentReader.read("bill-1", "pdf", FILE)).thenReturn(CONTENT);
        when(reasoningAdapter.summarizeBill(CONTENT)).thenThrow(new ExternalServiceException(
            "still failing", ErrorKind.RETRIES_EXHAUSTED, 3, ErrorKind.SERVER_ERROR, null));
        
        assertThat(summarizer.summarize("bill-1", "pdf", FILE)).isEmpty();
    }
    
    @Test
    void shouldReturnEmpty_whenBillCannotBeRead() throws IOException {
        when(reasoningAdapter.isConfigured()).thenReturn(true);
        when(contentReader.read("bill-1", "pdf", FILE)).thenThrow(new IOException("Header doesn't contain versioninfo"));
        
        assertThat(summarizer.summarize("bill-1", "pdf", FILE)).isEmpty();
        verify(reasoningAdapter, never()).summarizeBill(any());
    }
    
    @Test
    void shouldSkipSummary_whenReasoningServiceNotConfigured() {
        when(reasoningAdapter.isConfigured()).thenReturn(false);
        
        assertThat(summarizer.summarize("bill-1", "pdf", FILE)).isEmpty();
        verifyNoInteractions(contentReader);
    }
}
