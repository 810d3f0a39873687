package com.hashfleet.monitor.config;

import com.hashfleet.monitor.storage.BackendUnavailableException;
import com.hashfleet.monitor.storage.HistoryStore;
import com.hashfleet.monitor.storage.UnavailableHistoryStore;
import com.hashfleet.monitor.storage.bigtable.BigtableHistoryStore;
import com.hashfleet.monitor.storage.bigtable.BigtableWideColumnTable;
import com.hashfleet.monitor.storage.sqlite.SqliteHistoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Selects the history backend at start-up.
 * <p>
 * Backends:
 * - sqlite: embedded row store (default)
 * - bigtable: Cloud Bigtable wide-column store
 * <p>
 * A backend that fails to initialize does not stop the application: the
 * store is replaced by {@link UnavailableHistoryStore}.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Value("${storage.backend:sqlite}")
    private String backend;

    @Value("${storage.sqlite.path:./data/hashrate.db}")
    private String sqlitePath;

    @Value("${storage.bigtable.project-id:}")
    private String bigtableProjectId;

    @Value("${storage.bigtable.instance-id:}")
    private String bigtableInstanceId;

    @Value("${storage.bigtable.table-id:hashrate-monitor}")
    private String bigtableTableId;

    @Bean(destroyMethod = "close")
    public HistoryStore historyStore(Clock clock) {
        try {
            HistoryStore store = switch (backend.toLowerCase()) {
                case "sqlite" -> new SqliteHistoryStore(sqlitePath, clock);
                case "bigtable" -> createBigtableStore(clock);
                default -> throw new BackendUnavailableException("Unknown storage backend '" + backend + "'");
            };
            log.info("Using {} history backend", store.backendName());
            return store;
        } catch (BackendUnavailableException e) {
            log.error("Failed to initialize {} history backend", backend, e);
            return new UnavailableHistoryStore(backend, e.getMessage());
        }
    }

    private HistoryStore createBigtableStore(Clock clock) {
        if (bigtableProjectId.isBlank() || bigtableInstanceId.isBlank()) {
            throw new BackendUnavailableException(
                    "storage.bigtable.project-id and storage.bigtable.instance-id must be set");
        }
        BigtableWideColumnTable table = new BigtableWideColumnTable(
                bigtableProjectId,
                bigtableInstanceId,
                bigtableTableId,
                BigtableHistoryStore.FAMILIES
        );
        return new BigtableHistoryStore(table, clock);
    }
}
