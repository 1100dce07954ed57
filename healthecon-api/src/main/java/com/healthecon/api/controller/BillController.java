package com.healthecon.api.controller;

import com.healthecon.api.dto.response.BillResponse;
import com.healthecon.core.service.BillService;
import com.healthecon.data.entity.Bill;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/v1/bills")
@RequiredArgsConstructor
@Slf4j
public class BillController {
    
    private static final int MAX_PAGE_SIZE = 100;
    
    private final BillService billService;
    
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BillResponse> upload(@RequestParam("file") MultipartFile file) {
        log.debug("[API] Bill upload received | fileName={} | sizeBytes={} | contentType={}",
            file.getOriginalFilename(), file.getSize(), file.getContentType());
        
        Bill bill = billService.register(file);
        return ResponseEntity.status(HttpStatus.CREATED).body(BillResponse.from(bill));
    }
    
    /**
     * Newest first.
     */
    @GetMapping
    public ResponseEntity<Page<BillResponse>> list(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.max(1, Math.min(size, MAX_PAGE_SIZE)));
        return ResponseEntity.ok(billService.list(pageable).map(BillResponse::from));
    }
    
    @GetMapping("/{billId}")
    public ResponseEntity<BillResponse> get(@PathVariable String billId) {
        return ResponseEntity.ok(BillResponse.from(billService.get(billId)));
    }
}
