package com.hashfleet.monitor.ingest;

import com.hashfleet.monitor.broadcast.ReportBroadcaster;
import com.hashfleet.monitor.broadcast.ReportUpdate;
import com.hashfleet.monitor.model.ProducerReport;
import com.hashfleet.monitor.registry.LiveRegistry;
import com.hashfleet.monitor.storage.HistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single entry point for inbound reports, whatever transport they came on.
 * <p>
 * Order of effects:
 * - validate (nothing happens on failure)
 * - update the live registry
 * - publish {instance, stats} to observers
 * - persist to the history store
 * <p>
 * A persistence failure is rethrown to the caller but does not undo the
 * registry update or the broadcast; the live view and the history may diverge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportIngestionService {

    private final LiveRegistry registry;
    private final ReportBroadcaster broadcaster;
    private final HistoryStore historyStore;

    /**
     * @param originAddress server-side notion of where the report came from
     * @return the report as stored in the live registry
     * @throws ReportValidationException if a required field is missing
     * @throws com.hashfleet.monitor.storage.PersistenceException if the history write failed
     */
    public ProducerReport ingest(ReportRequest request, String originAddress) {
        ReportValidator.validate(request);

        ProducerReport stored = registry.update(request.toReport(originAddress));
        log.info("Received hashrate from {}: {} H/s", stored.getProducerId(),
                String.format("%.2f", stored.getRecentRate()));

        try {
            broadcaster.publish(new ReportUpdate(stored, registry.stats()));
        } catch (RuntimeException e) {
            log.warn("Failed to broadcast update of {}", stored.getProducerId(), e);
        }

        historyStore.write(stored);
        return stored;
    }
}
