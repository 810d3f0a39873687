package com.hashfleet.monitor.config;

import com.hashfleet.monitor.storage.HistoryStore;
import com.hashfleet.monitor.storage.PersistenceException;
import com.hashfleet.monitor.storage.SummaryWindow;
import com.hashfleet.monitor.storage.UnavailableHistoryStore;
import com.hashfleet.monitor.storage.sqlite.SqliteHistoryStore;
import com.hashfleet.monitor.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.hashfleet.monitor.testutil.TestFactory.BASE;
import static com.hashfleet.monitor.testutil.TestFactory.report;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StorageConfigTest {

    @TempDir
    Path tempDir;

    private StorageConfig config(String backend, String sqlitePath, String projectId, String instanceId) {
        StorageConfig config = new StorageConfig();
        ReflectionTestUtils.setField(config, "backend", backend);
        ReflectionTestUtils.setField(config, "sqlitePath", sqlitePath);
        ReflectionTestUtils.setField(config, "bigtableProjectId", projectId);
        ReflectionTestUtils.setField(config, "bigtableInstanceId", instanceId);
        ReflectionTestUtils.setField(config, "bigtableTableId", "hashrate-monitor");
        return config;
    }

    @Test
    void testSqliteBackendSelected() {
        String path = tempDir.resolve("data/hashrate.db").toString();

        HistoryStore store = config("sqlite", path, "", "").historyStore(new MutableClock(BASE));
        try {
            assertThat(store).isInstanceOf(SqliteHistoryStore.class);
            assertThat(store.backendName()).isEqualTo("sqlite");
        } finally {
            store.close();
        }
    }

    @Test
    void testBackendNameIsCaseInsensitive() {
        String path = tempDir.resolve("hashrate.db").toString();

        HistoryStore store = config("SQLite", path, "", "").historyStore(new MutableClock(BASE));
        try {
            assertThat(store).isInstanceOf(SqliteHistoryStore.class);
        } finally {
            store.close();
        }
    }

    /**
     * An unknown backend name starts the service in degraded mode.
     */
    @Test
    void testUnknownBackendFallsBackToUnavailable() {
        HistoryStore store = config("xyz", tempDir.resolve("hashrate.db").toString(), "", "")
                .historyStore(new MutableClock(BASE));

        assertThat(store).isInstanceOf(UnavailableHistoryStore.class);
        assertThat(store.backendName()).isEqualTo("xyz (unavailable)");
        assertThat(store.queryInstances()).isEmpty();
        assertThat(store.querySummary(24).window()).isEqualTo(SummaryWindow.UNAVAILABLE);
        assertThatThrownBy(() -> store.write(report("p1", 100, 1.0)))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("Unknown storage backend 'xyz'");
    }

    @Test
    void testBigtableWithoutIdsFallsBackToUnavailable() {
        HistoryStore store = config("bigtable", "", " ", "")
                .historyStore(new MutableClock(BASE));

        assertThat(store).isInstanceOf(UnavailableHistoryStore.class);
        assertThat(store.backendName()).isEqualTo("bigtable (unavailable)");
        assertThatThrownBy(() -> store.write(report("p1", 100, 1.0)))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("storage.bigtable.project-id");
    }

    /**
     * The database directory would have to live under a regular file.
     */
    @Test
    void testUnopenableSqlitePathFallsBackToUnavailable() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        String path = blocker.resolve("data/hashrate.db").toString();

        HistoryStore store = config("sqlite", path, "", "").historyStore(new MutableClock(BASE));

        assertThat(store).isInstanceOf(UnavailableHistoryStore.class);
        assertThat(store.backendName()).isEqualTo("sqlite (unavailable)");
        assertThat(store.queryHistory("p1", 24)).isEmpty();
        assertThat(store.cleanup(7)).isZero();
    }
}
