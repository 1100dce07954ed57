package com.healthecon.core.service;

import com.healthecon.core.processor.BillContentReader;
import com.healthecon.llm.model.BillContent;
import com.healthecon.llm.model.ReasoningResult;
import com.healthecon.llm.service.ExternalServiceException;
import com.healthecon.llm.service.ReasoningClientAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Asks the reasoning service for a short summary of an uploaded bill.
 * A bill that cannot be read or summarized is reported as empty so the upload still succeeds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillSummarizer {

    private final BillContentReader contentReader;
    private final ReasoningClientAdapter reasoningAdapter;

    public Optional<String> summarize(String billId, String fileType, Path file) {
        if (!reasoningAdapter.isConfigured()) {
            log.info("[BILLS] Reasoning service not configured, bill left pending | billId={}", billId);
            return Optional.empty();
        }

        try {
            BillContent content = contentReader.read(billId, fileType, file);
            ReasoningResult result = reasoningAdapter.summarizeBill(content);
            log.info("[BILLS] Bill summarized | billId={} | attempts={} | latencyMs={} | summaryLength={}",
                billId, result.getAttempts(), result.getLatencyMs(), result.getAnswer().length());
            return Optional.of(result.getAnswer());
        } catch (IOException e) {
            log.warn("[BILLS] Could not read bill for summary | billId={} | error={}", billId, e.getMessage());
        } catch (ExternalServiceException e) {
            log.warn("[BILLS] Bill summary failed, bill left pending | billId={} | kind={} | attempts={} | error={}",
                billId, e.getKind(), e.getAttempts(), e.getMessage());
        }
        return Optional.empty();
    }
}
