package com.realestate.scraper;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for exporting projected rows: JSON arrays via Jackson, CSV files via OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Every one of the ten tables is written, an empty table as an empty array or a header-only CSV.</li>
 *   <li>Columns follow {@link TableName#columns()}; decimals are written in plain notation.</li>
 *   <li>In CSV, list values are joined with {@code "; "} and line breaks are collapsed into spaces.</li>
 * </ul>
 * Directory layout and batch naming stay with the caller.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class TableExportService implements TableExportServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(TableExportService.class);

    private static final TypeReference<Map<String, Object>> ROW_MAP = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    @Override
    public List<Path> writeJson(RowSet rows, Path directory) throws IOException {
        requireArguments(rows, directory);
        Files.createDirectories(directory);
        List<Path> written = new ArrayList<>();
        for (TableName table : TableName.values()) {
            Path file = directory.resolve(table.tableName() + ".json");
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                mapper.writeValue(writer, rows.rows(table));
            }
            written.add(file);
        }
        logger.info("Wrote {} JSON table(s) to {}", written.size(), directory);
        return written;
    }

    @Override
    public List<Path> writeCsv(RowSet rows, Path directory) throws IOException {
        requireArguments(rows, directory);
        Files.createDirectories(directory);
        List<Path> written = new ArrayList<>();
        for (TableName table : TableName.values()) {
            Path file = directory.resolve(table.tableName() + ".csv");
            try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
                writer.writeNext(table.columns().toArray(String[]::new));
                for (Object row : rows.rows(table)) {
                    Map<String, Object> values = mapper.convertValue(row, ROW_MAP);
                    writer.writeNext(table.columns().stream().map(c -> cell(values.get(c))).toArray(String[]::new));
                }
            }
            written.add(file);
            logger.debug("Wrote {} row(s) to {}", rows.rows(table).size(), file);
        }
        logger.info("Wrote {} CSV table(s) to {}", written.size(), directory);
        return written;
    }

    private static void requireArguments(RowSet rows, Path directory) {
        if (rows == null) {
            logger.warn("Attempted to export a null row set");
            throw new IllegalArgumentException("Row set cannot be null");
        }
        if (directory == null) {
            logger.warn("Attempted to export without a target directory");
            throw new IllegalArgumentException("Directory cannot be null");
        }
    }

    /**
     * Converts one value to its CSV cell text.
     */
    private static String cell(Object value) {
        if (value == null) return "";
        if (value instanceof BigDecimal d) return d.toPlainString();
        if (value instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).map(TableExportService::safe).collect(Collectors.joining("; "));
        }
        return safe(value.toString());
    }

    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
