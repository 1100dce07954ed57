package com.healthecon.core.service;

import com.healthecon.common.constants.BillStatus;
import com.healthecon.common.constants.FileTypes;
import com.healthecon.common.exception.BillNotFoundException;
import com.healthecon.common.exception.StorageException;
import com.healthecon.common.exception.ValidationException;
import com.healthecon.common.util.FileUtils;
import com.healthecon.data.entity.Bill;
import com.healthecon.data.repository.BillRepository;
import com.healthecon.llm.model.ReasoningRequest.ContextDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bill documents that queries may reference. The query engine only needs existence checks
 * and the context handed to the reasoning service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillService {
    
    private final BillRepository billRepository;
    private final FileStorageService fileStorageService;
    private final BillSummarizer billSummarizer;
    private final Clock clock;
    
    /**
     * Returns the ids that do not name a stored bill, sorted.
     */
    public Set<String> findUnknown(Collection<String> billIds) {
        if (billIds == null || billIds.isEmpty()) {
            return Set.of();
        }
        Set<String> requested = new TreeSet<>(billIds);
        try {
            requested.removeAll(new HashSet<>(billRepository.findExistingIds(requested)));
        } catch (DataAccessException e) {
            throw new StorageException("Bill store unavailable", e);
        }
        return requested;
    }
    
    public Bill register(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("File must not be empty");
        }
        if (!FileUtils.isValidBillFile(file.getOriginalFilename(), file.getSize())) {
            throw new ValidationException("Unsupported bill file: only " + new TreeSet<>(FileTypes.SUPPORTED_EXTENSIONS)
                + " up to " + (FileTypes.MAX_FILE_SIZE_BYTES / (1024 * 1024)) + "MB are accepted");
        }
        
        // Record first so the stored file can be named after the bill id
        Bill bill = Bill.builder()
            .fileName(FileUtils.sanitizeFileName(file.getOriginalFilename()))
            .originalFileName(file.getOriginalFilename())
            .fileType(FileUtils.getFileExtension(file.getOriginalFilename()))
            .fileSizeBytes(file.getSize())
            .mimeType(file.getContentType())
            .status(BillStatus.PENDING)
            .uploadedAt(clock.instant().truncatedTo(ChronoUnit.MICROS))
            .build();
        
        try {
            bill = billRepository.save(bill);
        } catch (DataAccessException e) {
            throw new StorageException("Bill store unavailable", e);
        }
        
        try {
            Path stored = fileStorageService.saveFile(file, bill.getId());
            bill.setStoragePath(stored.toString());
            applySummary(bill, stored);
            bill = billRepository.save(bill);
        } catch (IOException | DataAccessException e) {
            log.error("[BILLS] Failed to store bill, removing file and record | billId={} | error={}",
                bill.getId(), e.getMessage());
            StorageException failure = new StorageException("Failed to save bill file", e);
            discard(bill, failure);
            throw failure;
        }
        
        log.info("[BILLS] Bill uploaded | billId={} | fileName={} | sizeBytes={} | status={}",
            bill.getId(), bill.getOriginalFileName(), bill.getFileSizeBytes(), bill.getStatus());
        return bill;
    }
    
    private void applySummary(Bill bill, Path stored) {
        billSummarizer.summarize(bill.getId(), bill.getFileType(), stored).ifPresent(summary -> {
            bill.setSummary(summary);
            bill.setStatus(BillStatus.PROCESSED);
            bill.setProcessedAt(clock.instant().truncatedTo(ChronoUnit.MICROS));
        });
    }
    
    // Cleanup failures are attached to the original error rather than replacing it
    private void discard(Bill bill, StorageException failure) {
        try {
            fileStorageService.deleteFile(bill.getId());
        } catch (IOException e) {
            log.warn("[BILLS] Could not remove stored file | billId={} | error={}", bill.getId(), e.getMessage());
            failure.addSuppressed(e);
        }
        try {
            billRepository.delete(bill);
        } catch (DataAccessException e) {
            log.warn("[BILLS] Could not remove bill record | billId={} | error={}", bill.getId(), e.getMessage());
            failure.addSuppressed(e);
        }
    }
    
    public Page<Bill> list(Pageable pageable) {
        return billRepository.findAllByOrderByUploadedAtDesc(pageable);
    }
    
    public Bill get(String billId) {
        return billRepository.findById(billId)
            .orElseThrow(() -> new BillNotFoundException(billId));
    }
    
    public long count() {
        return billRepository.count();
    }
    
    /**
     * Context handed to the reasoning service, in the order of {@code billIds}. Ids that vanished are skipped.
     */
    public List<ContextDocument> contextDocuments(List<String> billIds) {
        if (billIds == null || billIds.isEmpty()) {
            return List.of();
        }
        Map<String, Bill> bills;
        try {
            bills = billRepository.findAllById(billIds).stream()
                .collect(Collectors.toMap(Bill::getId, Function.identity()));
        } catch (DataAccessException e) {
            throw new StorageException("Bill store unavailable", e);
        }
        return billIds.stream()
            .filter(bills::containsKey)
            .map(bills::get)
            .map(bill -> ContextDocument.builder()
                .id(bill.getId())
                .fileName(bill.getOriginalFileName())
                .summary(bill.getSummary())
                .build())
            .toList();
    }
}
