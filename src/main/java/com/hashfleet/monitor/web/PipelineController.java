package com.hashfleet.monitor.web;

import com.hashfleet.monitor.health.AlertRecord;
import com.hashfleet.monitor.health.PipelineHealthMonitor;
import com.hashfleet.monitor.health.PipelineMetricsView;
import com.hashfleet.monitor.health.PipelineUpdate;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints of the pipeline health monitor.
 */
@RestController
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineHealthMonitor monitor;

    @PostMapping("/api/firehose/update")
    public Map<String, String> update(@RequestBody PipelineUpdate update) {
        monitor.apply(update);
        return Map.of("status", "success");
    }

    @GetMapping("/api/firehose/metrics")
    public PipelineMetricsView metrics() {
        return monitor.metrics();
    }

    @GetMapping("/api/firehose/alerts")
    public List<AlertRecord> alerts() {
        return monitor.alerts();
    }
}
