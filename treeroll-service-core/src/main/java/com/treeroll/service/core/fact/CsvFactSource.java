package com.treeroll.service.core.fact;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

/**
 * Reads a fact table from a CSV resource with a header row. Columns listed as measures are parsed as
 * decimals (blank cells become null); every other column is a dimension.
 */
@Slf4j
public class CsvFactSource implements FactSource {
    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private final Resource resource;
    private final Set<String> measureColumns;

    public CsvFactSource(Resource resource, Set<String> measureColumns) {
        if (resource == null) {
            throw new IllegalArgumentException("CSV resource is required");
        }
        this.resource = resource;
        this.measureColumns = measureColumns == null ? Set.of() : Set.copyOf(measureColumns);
    }

    @Override
    public FactTable read() {
        if (!resource.exists() || !resource.isReadable()) {
            throw new FactSourceException("Fact CSV not readable: " + resource.getDescription());
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (InputStream in = resource.getInputStream();
                MappingIterator<Map<String, String>> it =
                        CSV_MAPPER.readerFor(Map.class).with(schema).readValues(in)) {
            List<String> header = null;
            List<FactRow> rows = new ArrayList<>();
            int line = 1;
            while (it.hasNext()) {
                line++;
                Map<String, String> record = it.next();
                if (header == null) {
                    header = List.copyOf(record.keySet());
                }
                rows.add(toRow(record, line));
            }
            if (header == null) {
                header = headerOf(it);
            }
            List<String> dimensions = new ArrayList<>();
            List<String> measures = new ArrayList<>();
            for (String column : header) {
                (measureColumns.contains(column) ? measures : dimensions).add(column);
            }
            log.info("Loaded {} fact rows from {} (dimensions={}, measures={})",
                    rows.size(), resource.getDescription(), dimensions, measures);
            return new FactTable(new FactSchema(dimensions, measures), rows);
        } catch (IOException ex) {
            throw new FactSourceException("Failed to read fact CSV " + resource.getDescription(), ex);
        }
    }

    @Override
    public String describe() {
        return "csv(" + resource.getDescription() + ")";
    }

    private FactRow toRow(Map<String, String> record, int line) {
        Map<String, String> dimensions = new LinkedHashMap<>();
        Map<String, BigDecimal> measures = new LinkedHashMap<>();
        for (Map.Entry<String, String> cell : record.entrySet()) {
            String column = cell.getKey();
            String raw = cell.getValue() == null ? null : cell.getValue().trim();
            if (measureColumns.contains(column)) {
                measures.put(column, parseMeasure(column, raw, line));
            } else {
                dimensions.put(column, raw == null || raw.isEmpty() ? null : raw);
            }
        }
        return new FactRow(dimensions, measures);
    }

    private BigDecimal parseMeasure(String column, String raw, int line) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(raw);
        } catch (NumberFormatException ex) {
            throw new FactSourceException(
                    "Invalid measure '" + column + "' at line " + line + " of " + resource.getDescription() + ": "
                            + raw,
                    ex);
        }
    }

    private static List<String> headerOf(MappingIterator<Map<String, String>> it) {
        if (it.getParser().getSchema() instanceof CsvSchema parsed) {
            List<String> columns = new ArrayList<>();
            parsed.forEach(column -> columns.add(column.getName()));
            return columns;
        }
        return List.of();
    }
}
