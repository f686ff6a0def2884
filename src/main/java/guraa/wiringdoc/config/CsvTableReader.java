package guraa.wiringdoc.config;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import guraa.wiringdoc.exception.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a CSV table with a header row into rows addressable by column name.
 */
final class CsvTableReader {

    private static final CsvMapper MAPPER = new CsvMapper();

    private CsvTableReader() {
    }

    /**
     * One data row of a table.
     */
    static final class Row {
        private final String file;
        private final int line;
        private final Map<String, String> values;

        Row(String file, int line, Map<String, String> values) {
            this.file = file;
            this.line = line;
            this.values = values;
        }

        String get(String column) {
            String value = values.get(column);
            return value == null ? "" : value.trim();
        }

        /**
         * Describe where this row lives, for error messages.
         */
        String where() {
            return file + " line " + line;
        }
    }

    /**
     * Read every data row of a table, checking that the header names the required columns.
     *
     * @param file The CSV file
     * @param requiredColumns The columns every row needs
     * @param problems Receives header problems
     * @return The data rows, each with the line it starts on
     * @throws ConfigurationException If the file is missing or is not valid CSV
     */
    static List<Row> read(Path file, List<String> requiredColumns, List<String> problems) {
        if (!Files.isRegularFile(file)) {
            throw ConfigurationException.of("table file not found: " + file);
        }
        String fileName = file.getFileName().toString();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Row> rows = new ArrayList<>();

        try (MappingIterator<Map<String, String>> iterator = MAPPER.readerForMapOf(String.class)
                .with(schema)
                .with(CsvParser.Feature.TRIM_SPACES)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(file.toFile())) {

            while (iterator.hasNextValue()) {
                // The parser sits at the start of the record here; lines count from 1, header included
                int line = iterator.getCurrentLocation().getLineNr();
                rows.add(new Row(fileName, line, iterator.nextValue()));
            }

            CsvSchema resolved = ((CsvParser) iterator.getParser()).getSchema();
            for (String column : requiredColumns) {
                if (resolved.column(column) == null) {
                    problems.add(fileName + " has no '" + column + "' column");
                }
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw ConfigurationException.of("cannot parse " + fileName + ": " + e.getMessage(), e);
        }
        return rows;
    }
}
