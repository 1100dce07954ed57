package com.healthecon.api.dto.response;

import com.healthecon.common.constants.BillStatus;
import com.healthecon.data.entity.Bill;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillResponse {
    private String id;
    private String fileName;
    private String fileType;
    private Long fileSizeBytes;
    private BillStatus status;
    private String summary;
    private Instant uploadedAt;
    private Instant processedAt;
    
    public static BillResponse from(Bill bill) {
        return BillResponse.builder()
            .id(bill.getId())
            .fileName(bill.getOriginalFileName())
            .fileType(bill.getFileType())
            .fileSizeBytes(bill.getFileSizeBytes())
            .status(bill.getStatus())
            .summary(bill.getSummary())
            .uploadedAt(bill.getUploadedAt())
            .processedAt(bill.getProcessedAt())
            .build();
    }
}
