package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.SnapshotNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// Key,Value rows hold already flattened paths; other tables become row_<i> maps.
public class FallbackFlattenLoad {
    static final String KEY_COLUMN = "Key";
    static final String VALUE_COLUMN = "Value";
    static final String ROW_PREFIX = "row_";

    public SnapshotNode.Tree load(TabularTable table) {
        Optional<String> keyColumn = table.column(KEY_COLUMN);
        Optional<String> valueColumn = table.column(VALUE_COLUMN);
        if (keyColumn.isPresent() && valueColumn.isPresent()) {
            return loadKeyValue(table, keyColumn.get(), valueColumn.get());
        }
        return loadRows(table);
    }

    private SnapshotNode.Tree loadKeyValue(TabularTable table, String keyColumn, String valueColumn) {
        Map<String, SnapshotNode> root = new LinkedHashMap<>();
        List<Map<String, String>> rows = table.rows();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            String key = TabularTable.cell(row, keyColumn);
            if (key.isEmpty()) {
                key = ROW_PREFIX + i;
            }
            root.put(key, SnapshotNode.text(TabularTable.cell(row, valueColumn)));
        }
        return new SnapshotNode.Tree(root);
    }

    private SnapshotNode.Tree loadRows(TabularTable table) {
        Map<String, SnapshotNode> root = new LinkedHashMap<>();
        List<Map<String, String>> rows = table.rows();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, SnapshotNode> cells = new LinkedHashMap<>();
            for (Map.Entry<String, String> cell : rows.get(i).entrySet()) {
                cells.put(cell.getKey(), SnapshotNode.text(cell.getValue() == null ? "" : cell.getValue()));
            }
            root.put(ROW_PREFIX + i, new SnapshotNode.Tree(cells));
        }
        return new SnapshotNode.Tree(root);
    }
}
