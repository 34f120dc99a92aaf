package org.janelia.coreprep.cores;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads core definitions from a CSV file with a header row.
 */
public class CoreMetadataReader {

    private static final Logger LOG = LoggerFactory.getLogger(CoreMetadataReader.class);

    static final String CORE_NAME = "core_name";
    static final String ROW_START = "row_start";
    static final String ROW_STOP = "row_stop";
    static final String COLUMN_START = "column_start";
    static final String COLUMN_STOP = "column_stop";
    static final String POLY_TYPE = "poly_type";
    static final String POLYGON_VERTICES = "polygon_vertices";
    static final String CHANNELS = "channels";

    private static final List<String> REQUIRED_COLUMNS = ImmutableList.of(CORE_NAME, ROW_START, ROW_STOP, COLUMN_START, COLUMN_STOP, POLY_TYPE);

    private final ObjectMapper objectMapper;

    public CoreMetadataReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<CoreSpec> read(Path metadataFile) {
        List<String[]> rows;
        try (Reader reader = Files.newBufferedReader(metadataFile, StandardCharsets.UTF_8)) {
            CsvParserSettings parserSettings = new CsvParserSettings();
            parserSettings.setLineSeparatorDetectionEnabled(true);
            parserSettings.setMaxCharsPerColumn(-1);
            CsvParser parser = new CsvParser(parserSettings);
            rows = parser.parseAll(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading core metadata " + metadataFile, e);
        }
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Core metadata file " + metadataFile + " is empty");
        }
        Map<String, Integer> columns = indexColumns(rows.get(0));
        REQUIRED_COLUMNS.forEach(column -> {
            if (!columns.containsKey(column)) {
                throw new IllegalArgumentException("Core metadata file " + metadataFile + " is missing required column '" + column + "'");
            }
        });
        Map<String, CoreSpec> cores = new LinkedHashMap<>();
        for (int rowIndex = 1; rowIndex < rows.size(); rowIndex++) {
            String[] row = rows.get(rowIndex);
            if (isBlankRow(row)) {
                continue;
            }
            CoreSpec core = parseRow(metadataFile, rowIndex, row, columns);
            if (cores.put(core.getCoreId(), core) != null) {
                throw new IllegalArgumentException("Duplicate core '" + core.getCoreId() + "' in row " + rowIndex + " of " + metadataFile);
            }
        }
        LOG.info("Read {} cores from {}", cores.size(), metadataFile);
        return ImmutableList.copyOf(cores.values());
    }

    private Map<String, Integer> indexColumns(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            if (StringUtils.isNotBlank(header[i])) {
                columns.put(header[i].trim().toLowerCase(), i);
            }
        }
        return columns;
    }

    private boolean isBlankRow(String[] row) {
        for (String value : row) {
            if (StringUtils.isNotBlank(value)) {
                return false;
            }
        }
        return true;
    }

    private CoreSpec parseRow(Path metadataFile, int rowIndex, String[] row, Map<String, Integer> columns) {
        String coreId = requiredValue(metadataFile, rowIndex, row, columns, CORE_NAME);
        BoundingBox bbox = new BoundingBox(
                intValue(metadataFile, rowIndex, row, columns, ROW_START),
                intValue(metadataFile, rowIndex, row, columns, ROW_STOP),
                intValue(metadataFile, rowIndex, row, columns, COLUMN_START),
                intValue(metadataFile, rowIndex, row, columns, COLUMN_STOP));
        GeometryKind geometryKind;
        try {
            geometryKind = GeometryKind.fromTypeName(requiredValue(metadataFile, rowIndex, row, columns, POLY_TYPE));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(e.getMessage() + " in row " + rowIndex + " column '" + POLY_TYPE + "' of " + metadataFile, e);
        }
        List<PolygonVertex> vertices = ImmutableList.of();
        if (geometryKind == GeometryKind.POLYGON) {
            vertices = parseVertices(metadataFile, rowIndex, requiredValue(metadataFile, rowIndex, row, columns, POLYGON_VERTICES));
        }
        List<String> channels = ImmutableList.of();
        String channelsValue = optionalValue(row, columns, CHANNELS);
        if (StringUtils.isNotBlank(channelsValue)) {
            channels = Splitter.on(';').trimResults().omitEmptyStrings().splitToList(channelsValue);
        }
        try {
            return new CoreSpec(coreId, bbox, geometryKind, vertices, channels);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(e.getMessage() + " in row " + rowIndex + " of " + metadataFile, e);
        }
    }

    private List<PolygonVertex> parseVertices(Path metadataFile, int rowIndex, String value) {
        List<List<Double>> pairs;
        try {
            pairs = objectMapper.readValue(value, new TypeReference<List<List<Double>>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed polygon vertices '" + value + "' in row " + rowIndex + " column '" + POLYGON_VERTICES + "' of " + metadataFile, e);
        }
        List<PolygonVertex> vertices = new ArrayList<>();
        for (List<Double> pair : pairs) {
            if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
                throw new IllegalArgumentException("Polygon vertex " + pair + " is not a [y, x] pair in row " + rowIndex + " column '" + POLYGON_VERTICES + "' of " + metadataFile);
            }
            vertices.add(new PolygonVertex(pair.get(0), pair.get(1)));
        }
        return vertices;
    }

    private int intValue(Path metadataFile, int rowIndex, String[] row, Map<String, Integer> columns, String column) {
        String value = requiredValue(metadataFile, rowIndex, row, columns, column);
        try {
            // bounds may have been written as floats
            return (int) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Non numeric value '" + value + "' in row " + rowIndex + " column '" + column + "' of " + metadataFile, e);
        }
    }

    private String requiredValue(Path metadataFile, int rowIndex, String[] row, Map<String, Integer> columns, String column) {
        String value = optionalValue(row, columns, column);
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("Missing value in row " + rowIndex + " column '" + column + "' of " + metadataFile);
        }
        return value.trim();
    }

    private String optionalValue(String[] row, Map<String, Integer> columns, String column) {
        Integer columnIndex = columns.get(column);
        if (columnIndex == null || columnIndex >= row.length) {
            return null;
        }
        return row[columnIndex];
    }
}
