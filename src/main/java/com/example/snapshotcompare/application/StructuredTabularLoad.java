package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.MalformedSnapshotException;
import com.example.snapshotcompare.domain.SnapshotNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class StructuredTabularLoad {
    static final String COMPONENT_COLUMN = "Component";
    static final List<String> PROPERTY_COLUMNS = List.of("Property", "Metric", "Sensor", "Key");
    static final String VALUE_COLUMN = "Value";

    public Optional<SnapshotNode.Tree> tryLoad(TabularTable table, String source)
            throws MalformedSnapshotException {
        Optional<String> componentColumn = table.column(COMPONENT_COLUMN);
        if (componentColumn.isEmpty()) {
            return Optional.empty();
        }
        String propertyColumn =
                table.firstColumn(PROPERTY_COLUMNS)
                        .orElseThrow(
                                () ->
                                        new MalformedSnapshotException(
                                                String.format(
                                                        "%s has a Component column but none of %s",
                                                        source, PROPERTY_COLUMNS)));
        Optional<String> valueColumn = table.column(VALUE_COLUMN);

        Map<String, Map<String, SnapshotNode>> components = new LinkedHashMap<>();
        List<Map<String, String>> rows = table.rows();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            String component = TabularTable.cell(row, componentColumn.get());
            String property = TabularTable.cell(row, propertyColumn);
            if (component.isBlank()) {
                throw missingField(source, i, COMPONENT_COLUMN);
            }
            if (property.isBlank()) {
                throw missingField(source, i, propertyColumn.trim());
            }
            String value = valueColumn.map(column -> TabularTable.cell(row, column)).orElse("");
            components
                    .computeIfAbsent(component, key -> new LinkedHashMap<>())
                    .put(property, SnapshotNode.text(value));
        }

        Map<String, SnapshotNode> root = new LinkedHashMap<>();
        components.forEach((component, properties) -> root.put(component, new SnapshotNode.Tree(properties)));
        return Optional.of(new SnapshotNode.Tree(root));
    }

    private static MalformedSnapshotException missingField(String source, int rowIndex, String field) {
        return new MalformedSnapshotException(
                String.format(
                        "Row at line %d of %s is missing the %s field",
                        TabularTable.lineOf(rowIndex), source, field));
    }
}
