package com.healthecon.data.entity;

import com.healthecon.common.constants.ErrorKind;
import com.healthecon.common.constants.QueryStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A submitted research query and its outcome.
 * No setters: state changes go through the conditional updates in {@code QueryRecordRepository},
 * so a record in a terminal status is never rewritten.
 */
@Entity
@Table(name = "queries", indexes = {
    @Index(name = "idx_queries_fingerprint", columnList = "fingerprint, status, completed_at"),
    @Index(name = "idx_queries_created_at", columnList = "created_at, id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class QueryRecord {
    
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;
    
    @Column(name = "raw_text", nullable = false, columnDefinition = "TEXT")
    private String rawText;
    
    @Column(name = "normalized_text", nullable = false, columnDefinition = "TEXT")
    private String normalizedText;
    
    // Sorted and de-duplicated bill ids
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "query_context_refs", joinColumns = @JoinColumn(name = "query_id"))
    @OrderColumn(name = "position")
    @Column(name = "bill_id", nullable = false, length = 64)
    @Builder.Default
    private List<String> contextRefs = new ArrayList<>();
    
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    @Builder.Default
    private QueryStatus status = QueryStatus.PENDING;
    
    @Column(name = "result", columnDefinition = "TEXT")
    private String result;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 32)
    private ErrorKind errorKind;
    
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;
    
    @Column(name = "model", length = 64)
    private String model;
    
    @Column(name = "attempts")
    @Builder.Default
    private Integer attempts = 0;
    
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
    
    @Column(name = "started_at")
    private Instant startedAt;
    
    @Column(name = "completed_at")
    private Instant completedAt;
    
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
