package com.osman.badges.core.rows;

import com.osman.badges.core.InvalidConfigException;
import com.osman.badges.core.model.BadgeRecord;

import java.util.List;

/**
 * Turns raw rows into {@link BadgeRecord}s using configured column positions.
 */
public final class RecordMapper {

    private final int nameColumn;
    private final int identifierColumn;

    public RecordMapper(int nameColumn, int identifierColumn) {
        if (nameColumn < 0 || identifierColumn < 0) {
            throw new InvalidConfigException(
                "Column indices must not be negative (name=%d, identifier=%d)".formatted(nameColumn, identifierColumn));
        }
        this.nameColumn = nameColumn;
        this.identifierColumn = identifierColumn;
    }

    /**
     * @param row      cells of one data row
     * @param rowIndex 1-based position of the row among data rows
     * @throws RowParseException if the row has no cell at the name or identifier column, or
     *                           one of those cells was not valid UTF-8
     */
    public BadgeRecord toRecord(List<String> row, int rowIndex) throws RowParseException {
        if (row == null) {
            throw new RowParseException(rowIndex, "row is missing");
        }
        int required = Math.max(nameColumn, identifierColumn) + 1;
        if (row.size() < required) {
            throw new RowParseException(rowIndex,
                "expected at least %d columns (name at %d, identifier at %d) but found %d"
                    .formatted(required, nameColumn, identifierColumn, row.size()));
        }
        if (row instanceof CsvRow csvRow) {
            checkDecoded(csvRow, nameColumn, "name", rowIndex);
            checkDecoded(csvRow, identifierColumn, "identifier", rowIndex);
        }
        String name = row.get(nameColumn);
        String identifier = row.get(identifierColumn);
        return new BadgeRecord(name == null ? "" : name, identifier == null ? "" : identifier, rowIndex);
    }

    private static void checkDecoded(CsvRow row, int column, String field, int rowIndex) throws RowParseException {
        if (!row.isDecoded(column)) {
            throw new RowParseException(rowIndex, "%s column %d is not valid UTF-8".formatted(field, column));
        }
    }

    /**
     * Best-effort name for log messages about rows that may not map cleanly.
     */
    public String rawName(List<String> row) {
        if (row == null || row.size() <= nameColumn) {
            return "";
        }
        String name = row.get(nameColumn);
        return name == null ? "" : name;
    }
}
