package com.healthecon.data.repository;

import com.healthecon.data.entity.QueryRecord;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class QueryRecordRepositoryImpl implements QueryRecordRepositoryCustom {
    
    @PersistenceContext
    private EntityManager entityManager;
    
    @Override
    public List<QueryRecord> findHistoryPage(QueryHistoryFilter filter, Instant cursorCreatedAt, String cursorId, int limit) {
        StringBuilder jpql = new StringBuilder("SELECT q FROM QueryRecord q WHERE 1 = 1");
        Map<String, Object> params = new LinkedHashMap<>();
        
        if (filter != null) {
            if (filter.getFrom() != null) {
                jpql.append(" AND q.createdAt >= :from");
                params.put("from", filter.getFrom());
            }
            if (filter.getTo() != null) {
                jpql.append(" AND q.createdAt < :to");
                params.put("to", filter.getTo());
            }
            if (filter.getStatus() != null) {
                jpql.append(" AND q.status = :status");
                params.put("status", filter.getStatus());
            }
            if (filter.getBillId() != null) {
                jpql.append(" AND :billId MEMBER OF q.contextRefs");
                params.put("billId", filter.getBillId());
            }
        }
        
        // Cursor is (createdAt, id) of the last row already served
        if (cursorCreatedAt != null && cursorId != null) {
            jpql.append(" AND (q.createdAt < :cursorCreatedAt")
                .append(" OR (q.createdAt = :cursorCreatedAt AND q.id < :cursorId))");
            params.put("cursorCreatedAt", cursorCreatedAt);
            params.put("cursorId", cursorId);
        }
        
        jpql.append(" ORDER BY q.createdAt DESC, q.id DESC");
        
        TypedQuery<QueryRecord> query = entityManager.createQuery(jpql.toString(), QueryRecord.class);
        params.forEach(query::setParameter);
        query.setMaxResults(limit);
        return query.getResultList();
    }
}
