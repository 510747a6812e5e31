package com.osman.badges.core.rows;

import com.osman.badges.logging.AppLogger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads comma separated UTF-8 files into rows of string cells.
 * <p>
 * Quoted cells may contain commas, doubled quotes and line breaks. The first {@code skipRows}
 * rows (usually the header) are dropped, as are blank lines. A UTF-8 byte order mark is ignored.
 * Rows and cells are split on the raw bytes and each cell is decoded on its own, so a cell with
 * invalid UTF-8 only marks its own row (see {@link CsvRow#isDecoded(int)}).
 */
public class CsvRowReader {
    private static final Logger LOGGER = AppLogger.get();

    private static final byte QUOTE = '"';
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    private final int skipRows;
    private final byte delimiter;

    public CsvRowReader(int skipRows) {
        this(skipRows, ',');
    }

    public CsvRowReader(int skipRows, char delimiter) {
        if (skipRows < 0) {
            throw new IllegalArgumentException("skipRows must not be negative, was " + skipRows);
        }
        if (delimiter >= 0x80 || delimiter == '"' || delimiter == '\r' || delimiter == '\n') {
            throw new IllegalArgumentException("Delimiter must be an ASCII character other than quote or line break");
        }
        this.skipRows = skipRows;
        this.delimiter = (byte) delimiter;
    }

    /**
     * Parse the provided file.
     *
     * @param file source CSV file
     * @return data rows in file order
     * @throws IOException if the file cannot be read
     */
    public List<List<String>> read(Path file) throws IOException {
        return parse(Files.readAllBytes(file));
    }

    /**
     * Parse the provided stream. The stream is read to its end but not closed.
     */
    public List<List<String>> read(InputStream in) throws IOException {
        return parse(in.readAllBytes());
    }

    private List<List<String>> parse(byte[] data) {
        RowBuilder builder = new RowBuilder();
        int i = startsWithBom(data) ? 3 : 0;
        boolean inQuotes = false;

        while (i < data.length) {
            byte b = data[i];
            if (inQuotes) {
                if (b == QUOTE) {
                    if (i + 1 < data.length && data[i + 1] == QUOTE) {
                        builder.cell.write(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    builder.cell.write(b);
                }
            } else if (b == QUOTE && builder.cell.size() == 0) {
                inQuotes = true;
                builder.cellStarted = true;
            } else if (b == delimiter) {
                builder.endCell();
                builder.cellStarted = true;
            } else if (b == LF || b == CR) {
                if (b == CR && i + 1 < data.length && data[i + 1] == LF) {
                    i++;
                }
                builder.endRow();
            } else {
                builder.cell.write(b);
                builder.cellStarted = true;
            }
            i++;
        }

        if (inQuotes) {
            LOGGER.warning("CSV input ended inside a quoted cell; keeping the partial cell.");
        }
        if (builder.cellStarted || !builder.row.isEmpty()) {
            builder.cellStarted = true;
            builder.endRow();
        }
        return builder.rows;
    }

    private static boolean startsWithBom(byte[] data) {
        return data.length >= 3
            && (data[0] & 0xFF) == 0xEF
            && (data[1] & 0xFF) == 0xBB
            && (data[2] & 0xFF) == 0xBF;
    }

    private final class RowBuilder {
        private final List<List<String>> rows = new ArrayList<>();
        private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        private final ByteArrayOutputStream cell = new ByteArrayOutputStream();
        private List<String> row = new ArrayList<>();
        private Set<Integer> undecodable = new HashSet<>();
        private boolean cellStarted;
        private int rawRowCount;

        void endCell() {
            byte[] bytes = cell.toByteArray();
            cell.reset();
            try {
                decoder.reset();
                row.add(decoder.decode(ByteBuffer.wrap(bytes)).toString());
            } catch (CharacterCodingException ex) {
                undecodable.add(row.size());
                row.add(new String(bytes, StandardCharsets.UTF_8));
            }
        }

        void endRow() {
            rawRowCount++;
            boolean blank = !cellStarted && row.isEmpty();
            if (rawRowCount > skipRows && !blank) {
                endCell();
                if (!undecodable.isEmpty()) {
                    LOGGER.warning("Row %d has cells that are not valid UTF-8 (columns %s)"
                        .formatted(rows.size() + 1, undecodable));
                }
                rows.add(new CsvRow(row, undecodable));
            }
            cell.reset();
            row = new ArrayList<>();
            undecodable = new HashSet<>();
            cellStarted = false;
        }
    }
}
