package com.di.segmerge.io;

import com.di.segmerge.table.SegmentTable;
import com.di.segmerge.util.CellValues;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes segment tables as a JSON array of row objects.
 *
 * <p>Columns appear in order of first appearance across rows; a key absent from a row is a
 * missing cell. Integral numbers are read as {@link Long}, other numbers as {@link Double}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SegmentTableJson {

    private final ObjectMapper objectMapper;

    public SegmentTable read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            SegmentTable table = read(in);
            log.info("[JSON] read {} row(s), columns {} from {}", table.size(), table.columns(), file);
            return table;
        }
    }

    public SegmentTable read(InputStream in) throws IOException {
        return fromTree(objectMapper.readTree(in));
    }

    public SegmentTable read(String json) throws IOException {
        return fromTree(objectMapper.readTree(json));
    }

    public void write(SegmentTable table, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), toTree(table));
        log.info("[JSON] wrote {} row(s) to {}", table.size(), file);
    }

    public String writeAsString(SegmentTable table) throws IOException {
        return objectMapper.writeValueAsString(toTree(table));
    }

    /* ------------------------------------------------------------------ */

    private SegmentTable fromTree(JsonNode root) throws IOException {
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of row objects");
        }
        LinkedHashSet<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> rows = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new IOException("Expected a JSON object per row, got " + node.getNodeType());
            }
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                columns.add(field.getKey());
                row.put(field.getKey(), toCell(field.getValue()));
            }
            rows.add(row);
        }
        SegmentTable.Builder builder = SegmentTable.builder(new ArrayList<>(columns));
        for (Map<String, Object> row : rows) {
            builder.addRow(row);
        }
        return builder.build();
    }

    private static Object toCell(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? (Object) value.longValue() : value.bigIntegerValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        return value.toString();
    }

    private ArrayNode toTree(SegmentTable table) {
        ArrayNode array = objectMapper.createArrayNode();
        for (int i = 0; i < table.size(); i++) {
            ObjectNode node = array.addObject();
            for (String c : table.columns()) {
                putCell(node, c, table.get(i, c));
            }
        }
        return array;
    }

    private static void putCell(ObjectNode node, String column, Object value) {
        if (CellValues.isMissing(value)) {
            node.putNull(column);
        } else if (value instanceof BigInteger big) {
            node.put(column, big);
        } else if (value instanceof BigDecimal dec) {
            node.put(column, dec);
        } else if (CellValues.isIntegral(value)) {
            node.put(column, ((Number) value).longValue());
        } else if (value instanceof Number n) {
            node.put(column, n.doubleValue());
        } else if (value instanceof Boolean b) {
            node.put(column, b);
        } else {
            node.put(column, value.toString());
        }
    }
}
