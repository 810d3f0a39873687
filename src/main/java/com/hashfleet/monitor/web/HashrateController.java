package com.hashfleet.monitor.web;

import com.hashfleet.monitor.ingest.ReportIngestionService;
import com.hashfleet.monitor.ingest.ReportRequest;
import com.hashfleet.monitor.model.AggregateStats;
import com.hashfleet.monitor.model.ProducerReport;
import com.hashfleet.monitor.registry.LiveRegistry;
import com.hashfleet.monitor.storage.HistoryRecord;
import com.hashfleet.monitor.storage.HistoryStore;
import com.hashfleet.monitor.storage.StoredInstance;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for producers (report ingest) and dashboards (live and
 * historical views).
 */
@RestController
@RequiredArgsConstructor
public class HashrateController {

    private final ReportIngestionService ingestionService;
    private final LiveRegistry registry;
    private final HistoryQueryService historyQueryService;
    private final HistoryStore historyStore;
    private final Clock clock;

    @PostMapping("/api/hashrate")
    public Map<String, String> receiveHashrate(@RequestBody(required = false) ReportRequest request,
                                               HttpServletRequest httpRequest) {
        ingestionService.ingest(request, originAddress(httpRequest));
        return Map.of("status", "success");
    }

    @GetMapping("/api/instances")
    public List<ProducerReport> instances() {
        return registry.snapshot();
    }

    @GetMapping("/api/stats")
    public AggregateStats stats() {
        return registry.stats();
    }

    @GetMapping("/api/history/{instanceId}")
    public List<HistoryRecord> history(@PathVariable String instanceId,
                                       @RequestParam(defaultValue = "24") int hours) {
        return historyQueryService.history(instanceId, hours);
    }

    @GetMapping("/api/summary")
    public FleetSummary summary() {
        return historyQueryService.summary();
    }

    @GetMapping("/api/stored-instances")
    public List<StoredInstance> storedInstances() {
        return historyQueryService.storedInstances();
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of(
                "status", "healthy",
                "timestamp", clock.instant().toString(),
                "backend", historyStore.backendName()
        );
    }

    private static String originAddress(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
