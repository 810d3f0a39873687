package com.hashfleet.monitor.storage.bigtable;

import java.util.List;
import java.util.Optional;

/**
 * A row read back from a {@link WideColumnTable}.
 */
public record WideColumnRow(String key, List<CellValue> cells) {

    /**
     * Newest version of one column, if present.
     */
    public Optional<CellValue> cell(String family, String qualifier) {
        CellValue newest = null;
        for (CellValue cell : cells) {
            if (cell.family().equals(family) && cell.qualifier().equals(qualifier)
                    && (newest == null || cell.timestampMicros() > newest.timestampMicros())) {
                newest = cell;
            }
        }
        return Optional.ofNullable(newest);
    }
}
