package com.hashfleet.monitor.storage.bigtable;

import java.util.List;
import java.util.stream.Stream;

/**
 * Minimal wide-column table operations the history store relies on.
 * <p>
 * Rows are returned in ascending key order. Runtime exceptions thrown by an
 * implementation signal a backend failure.
 */
public interface WideColumnTable extends AutoCloseable {

    /**
     * Write cells to one row atomically, creating the row if needed.
     */
    void mutateRow(String rowKey, List<CellValue> cells);

    /**
     * Rows whose key starts with {@code prefix}; an empty prefix scans the table.
     * The stream must be closed.
     */
    Stream<WideColumnRow> readRows(String prefix);

    void deleteRow(String rowKey);

    @Override
    void close();
}
