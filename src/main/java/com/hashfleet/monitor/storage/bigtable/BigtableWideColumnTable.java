package com.hashfleet.monitor.storage.bigtable;

import com.google.api.gax.rpc.ServerStream;
import com.google.cloud.bigtable.admin.v2.BigtableTableAdminClient;
import com.google.cloud.bigtable.admin.v2.models.CreateTableRequest;
import com.google.cloud.bigtable.data.v2.BigtableDataClient;
import com.google.cloud.bigtable.data.v2.models.Query;
import com.google.cloud.bigtable.data.v2.models.Row;
import com.google.cloud.bigtable.data.v2.models.RowCell;
import com.google.cloud.bigtable.data.v2.models.RowMutation;
import com.hashfleet.monitor.storage.BackendUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static com.google.cloud.bigtable.admin.v2.models.GCRules.GCRULES;

/**
 * {@link WideColumnTable} backed by a Cloud Bigtable table.
 * <p>
 * The table is created on start-up when missing, with one version kept per
 * column family.
 */
@Slf4j
public class BigtableWideColumnTable implements WideColumnTable {

    private final String tableId;
    private final BigtableDataClient dataClient;

    /**
     * @throws BackendUnavailableException if the data client cannot be created
     */
    public BigtableWideColumnTable(String projectId, String instanceId, String tableId, List<String> families) {
        this(
                tableId,
                () -> ensureTable(projectId, instanceId, tableId, families),
                () -> BigtableDataClient.create(projectId, instanceId)
        );
        log.info("Connected to Bigtable table {}/{}/{}", projectId, instanceId, tableId);
    }

    /**
     * A failed table check is logged and the data client is created anyway:
     * credentials limited to data access cannot use the admin API, and the
     * table may well exist already.
     */
    BigtableWideColumnTable(String tableId, TableSetup tableSetup, Callable<BigtableDataClient> dataClientFactory) {
        this.tableId = tableId;
        try {
            tableSetup.run();
        } catch (IOException | RuntimeException e) {
            log.error("Error setting up Bigtable table {}, continuing with data access", tableId, e);
        }
        try {
            this.dataClient = dataClientFactory.call();
        } catch (Exception e) {
            throw new BackendUnavailableException("Cannot connect to Bigtable table " + tableId, e);
        }
    }

    private static void ensureTable(String projectId, String instanceId, String tableId, List<String> families)
            throws IOException {
        try (BigtableTableAdminClient admin = BigtableTableAdminClient.create(projectId, instanceId)) {
            if (admin.exists(tableId)) {
                return;
            }
            log.info("Creating Bigtable table: {}", tableId);
            CreateTableRequest request = CreateTableRequest.of(tableId);
            for (String family : families) {
                request.addFamily(family, GCRULES.maxVersions(1));
            }
            admin.createTable(request);
            log.info("Bigtable table {} created", tableId);
        }
    }

    @Override
    public void mutateRow(String rowKey, List<CellValue> cells) {
        RowMutation mutation = RowMutation.create(tableId, rowKey);
        for (CellValue cell : cells) {
            mutation.setCell(cell.family(), cell.qualifier(), cell.timestampMicros(), cell.value());
        }
        dataClient.mutateRow(mutation);
    }

    @Override
    public Stream<WideColumnRow> readRows(String prefix) {
        Query query = Query.create(tableId);
        if (!prefix.isEmpty()) {
            query.prefix(prefix);
        }
        ServerStream<Row> rows = dataClient.readRows(query);
        return StreamSupport.stream(rows.spliterator(), false)
                .map(BigtableWideColumnTable::toRow)
                .onClose(rows::cancel);
    }

    @Override
    public void deleteRow(String rowKey) {
        dataClient.mutateRow(RowMutation.create(tableId, rowKey).deleteRow());
    }

    @Override
    public void close() {
        dataClient.close();
        log.info("Bigtable client for table {} closed", tableId);
    }

    private static WideColumnRow toRow(Row row) {
        List<CellValue> cells = new ArrayList<>(row.getCells().size());
        for (RowCell cell : row.getCells()) {
            cells.add(new CellValue(
                    cell.getFamily(),
                    cell.getQualifier().toStringUtf8(),
                    cell.getTimestamp(),
                    cell.getValue().toStringUtf8()
            ));
        }
        return new WideColumnRow(row.getKey().toStringUtf8(), cells);
    }

    /**
     * Makes sure the table and its column families exist.
     */
    @FunctionalInterface
    interface TableSetup {
        void run() throws IOException;
    }
}
