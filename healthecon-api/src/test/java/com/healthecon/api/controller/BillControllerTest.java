package com.healthecon.api.controller;

import com.healthecon.api.exception.GlobalExceptionHandler;
import com.healthecon.common.constants.BillStatus;
import com.healthecon.common.exception.BillNotFoundException;
import com.healthecon.common.exception.StorageException;
import com.healthecon.common.exception.ValidationException;
import com.healthecon.core.service.BillService;
import com.healthecon.data.entity.Bill;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class BillControllerTest {
    
    @Mock
    private BillService billService;
    
    private MockMvc mockMvc;
    
    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BillController(billService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }
    
    @Test
    void shouldRegisterUploadedBill() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "er visit.pdf", "application/pdf", new byte[]{1, 2, 3});
        when(billService.register(any())).thenReturn(bill("bill-1"));
        
        mockMvc.perform(multipart("/api/v1/bills").file(file))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("bill-1"))
            .andExpect(jsonPath("$.fileName").value("er visit.pdf"))
            .andExpect(jsonPath("$.status").value("PENDING"));
    }
    
    @Test
    void shouldRejectUnsupportedFile() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.docx", "application/octet-stream", new byte[]{1});
        when(billService.register(any())).thenThrow(new ValidationException("Unsupported bill file"));
        
        mockMvc.perform(multipart("/api/v1/bills").file(file))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unsupported bill file"));
    }
    
    @Test
    void shouldRequireFilePart() throws Exception {
        mockMvc.perform(multipart("/api/v1/bills"))
            .andExpect(status().isBadRequest());
        
        verifyNoInteractions(billService);
    }
    
    @Test
    void shouldReportStorageFailure() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "bill.png", "image/png", new byte[]{1});
        when(billService.register(any())).thenThrow(new StorageException("Failed to save bill file", new IOException("disk full")));
        
        mockMvc.perform(multipart("/api/v1/bills").file(file))
            .andExpect(status().isServiceUnavailable());
    }
    
    @Test
    void shouldListBillsNewestFirst() throws Exception {
        Pageable pageable = PageRequest.of(0, 20);
        when(billService.list(pageable)).thenReturn(new PageImpl<>(List.of(bill("bill-2"), bill("bill-1")), pageable, 2));
        
        mockMvc.perform(get("/api/v1/bills"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content[0].id").value("bill-2"))
            .andExpect(jsonPath("$.content[1].id").value("bill-1"));
    }
    
    @Test
    void shouldReturnNotFound_forUnknownBill() throws Exception {
        when(billService.get("missing")).thenThrow(new BillNotFoundException("missing"));
        
        mockMvc.perform(get("/api/v1/bills/missing"))
            .andExpect(status().isNotFound());
    }
    
    private static Bill bill(String id) {
        return Bill.builder()
            .id(id)
            .fileName("er_visit.pdf")
            .originalFileName("er visit.pdf")
            .fileType("pdf")
            .fileSizeBytes(3L)
            .mimeType("application/pdf")
            .status(BillStatus.PENDING)
            .uploadedAt(Instant.parse("2026-03-01T09:00:00Z"))
            .build();
    }
}
