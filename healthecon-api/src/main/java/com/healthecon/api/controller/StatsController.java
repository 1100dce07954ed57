package com.healthecon.api.controller;

import com.healthecon.core.inflight.InflightCoordinator;
import com.healthecon.core.service.BillService;
import com.healthecon.core.store.ResultStore;
import com.healthecon.llm.service.ReasoningClientAdapter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/stats")
@RequiredArgsConstructor
public class StatsController {
    
    private final ResultStore resultStore;
    private final BillService billService;
    private final InflightCoordinator coordinator;
    private final ReasoningClientAdapter reasoningAdapter;
    
    @GetMapping
    public ResponseEntity<Map<String, Object>> getStatistics() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        resultStore.countByStatus().forEach((status, count) -> byStatus.put(status.getWireValue(), count));
        
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalQueries", resultStore.count());
        stats.put("totalBills", billService.count());
        stats.put("queriesByStatus", byStatus);
        stats.put("inflight", coordinator.getStatistics());
        stats.put("reasoning", reasoningAdapter.getStatistics());
        return ResponseEntity.ok(stats);
    }
}
