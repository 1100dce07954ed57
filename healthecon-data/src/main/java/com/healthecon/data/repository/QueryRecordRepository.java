package com.healthecon.data.repository;

import com.healthecon.common.constants.ErrorKind;
import com.healthecon.common.constants.QueryStatus;
import com.healthecon.data.entity.QueryRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface QueryRecordRepository extends JpaRepository<QueryRecord, String>, QueryRecordRepositoryCustom {
    
    /**
     * Cache index lookup: newest record for the fingerprint in the given status, completed at or after {@code since}.
     */
    Optional<QueryRecord> findFirstByFingerprintAndStatusAndCompletedAtGreaterThanEqualOrderByCompletedAtDesc(
        String fingerprint,
        QueryStatus status,
        Instant since
    );
    
    @Query("SELECT q.status, COUNT(q) FROM QueryRecord q GROUP BY q.status")
    List<Object[]> countGroupedByStatus();
    
    /**
     * pending -> inFlight. Returns the number of rows changed (0 when the record already moved on).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE QueryRecord q
        SET q.status = :inFlight, q.startedAt = :startedAt
        WHERE q.id = :id AND q.status = :pending
        """)
    int markInFlight(
        @Param("id") String id,
        @Param("startedAt") Instant startedAt,
        @Param("pending") QueryStatus pending,
        @Param("inFlight") QueryStatus inFlight
    );
    
    /**
     * Moves a non-terminal record to complete. A record that is already terminal is left untouched.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE QueryRecord q
        SET q.status = :complete,
            q.result = :result,
            q.model = :model,
            q.attempts = :attempts,
            q.completedAt = :completedAt
        WHERE q.id = :id AND q.status IN :open
        """)
    int markComplete(
        @Param("id") String id,
        @Param("result") String result,
        @Param("model") String model,
        @Param("attempts") Integer attempts,
        @Param("completedAt") Instant completedAt,
        @Param("open") Collection<QueryStatus> open,
        @Param("complete") QueryStatus complete
    );
    
    /**
     * Moves a non-terminal record to failed. A record that is already terminal is left untouched.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE QueryRecord q
        SET q.status = :failed,
            q.errorKind = :errorKind,
            q.errorMessage = :errorMessage,
            q.attempts = :attempts,
            q.completedAt = :completedAt
        WHERE q.id = :id AND q.status IN :open
        """)
    int markFailed(
        @Param("id") String id,
        @Param("errorKind") ErrorKind errorKind,
        @Param("errorMessage") String errorMessage,
        @Param("attempts") Integer attempts,
        @Param("completedAt") Instant completedAt,
        @Param("open") Collection<QueryStatus> open,
        @Param("failed") QueryStatus failed
    );
}
