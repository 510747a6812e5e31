package com.osman.badges.core.rows;

import java.util.AbstractList;
import java.util.List;
import java.util.Set;

/**
 * One row read by {@link CsvRowReader}. Cells whose bytes were not valid UTF-8 hold a lossy
 * decoding, with U+FFFD for the bad bytes, and are reported by {@link #isDecoded(int)}.
 */
public final class CsvRow extends AbstractList<String> {

    private final List<String> cells;
    private final Set<Integer> undecodableColumns;

    CsvRow(List<String> cells, Set<Integer> undecodableColumns) {
        this.cells = List.copyOf(cells);
        this.undecodableColumns = Set.copyOf(undecodableColumns);
    }

    @Override
    public String get(int index) {
        return cells.get(index);
    }

    @Override
    public int size() {
        return cells.size();
    }

    public boolean isDecoded(int column) {
        return !undecodableColumns.contains(column);
    }

    public boolean isFullyDecoded() {
        return undecodableColumns.isEmpty();
    }
}
