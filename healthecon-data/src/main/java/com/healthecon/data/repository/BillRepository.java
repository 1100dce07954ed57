package com.healthecon.data.repository;

import com.healthecon.data.entity.Bill;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface BillRepository extends JpaRepository<Bill, String> {
    
    Page<Bill> findAllByOrderByUploadedAtDesc(Pageable pageable);
    
    /**
     * Returns which of the given ids exist, used to reject unknown context references in one round trip.
     */
    @Query("SELECT b.id FROM Bill b WHERE b.id IN :ids")
    List<String> findExistingIds(@Param("ids") Collection<String> ids);
}
