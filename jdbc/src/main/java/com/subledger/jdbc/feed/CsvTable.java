package com.subledger.jdbc.feed;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.subledger.engine.SubledgerException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A comma-separated feed file with a header row, read as one map per record. Header names are
 * matched case-insensitively and a leading byte order mark is ignored. Record numbers count the
 * header as 1, so they equal line numbers unless a quoted field spans lines.
 */
final class CsvTable {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final ObjectReader ROW_READER =
            CSV_MAPPER.readerForMapOf(String.class)
                    .with(CsvSchema.emptySchema().withHeader())
                    .with(CsvParser.Feature.TRIM_SPACES)
                    .with(CsvParser.Feature.SKIP_EMPTY_LINES);

    private final Path file;
    private final Map<String, String> header;
    private final List<Record> records;

    private CsvTable(Path file, Map<String, String> header, List<Record> records) {
        this.file = file;
        this.header = header;
        this.records = records;
    }

    static CsvTable read(Path file) throws SubledgerException {
        Map<String, String> header = new HashMap<>();
        List<Record> records = new ArrayList<>();
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                MappingIterator<Map<String, String>> rows = ROW_READER.readValues(in)) {
            boolean more = rows.hasNextValue();
            CsvSchema schema = (CsvSchema) rows.getParserSchema();
            for (int c = 0; schema != null && c < schema.size(); c++) {
                String name = schema.columnName(c);
                header.putIfAbsent(normalize(name), name);
            }
            while (more) {
                records.add(new Record(records.size() + 2, rows.nextValue()));
                more = rows.hasNextValue();
            }
        } catch (IOException ex) {
            throw malformed(file, records.size() + 2, ex);
        }
        if (header.isEmpty()) {
            throw new SubledgerException("Feed has no header row: " + file);
        }
        return new CsvTable(file, header, records);
    }

    Path getFile() {
        return file;
    }

    List<Record> getRecords() {
        return records;
    }

    /** Header name of the first of {@code names} present in the file. */
    String column(String... names) throws SubledgerException {
        String column = optionalColumn(names);
        if (column == null) {
            throw new SubledgerException(
                    "Feed " + file.getFileName() + " has no column " + String.join(" or ", names));
        }
        return column;
    }

    /** Like {@link #column(String...)} but null when absent. */
    String optionalColumn(String... names) {
        for (String name : names) {
            String column = header.get(normalize(name));
            if (column != null) {
                return column;
            }
        }
        return null;
    }

    private static SubledgerException malformed(Path file, int recordNumber, IOException ex) {
        return new SubledgerException(
                "Malformed CSV at " + file.getFileName() + ":" + recordNumber + ": " + ex.getMessage(), ex);
    }

    private static String normalize(String name) {
        String trimmed = name.trim();
        if (trimmed.startsWith("\uFEFF")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    /** One data record and its position in the file. */
    record Record(int lineNumber, Map<String, String> cells) {
        String get(String column) {
            if (column == null) {
                return null;
            }
            String value = cells.get(column);
            return value == null || value.isEmpty() ? null : value;
        }
    }
}
