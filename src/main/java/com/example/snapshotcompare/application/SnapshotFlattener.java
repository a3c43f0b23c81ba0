package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.FlatEntry;
import com.example.snapshotcompare.domain.SnapshotNode;
import com.example.snapshotcompare.domain.SnapshotPath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class SnapshotFlattener {

    public List<FlatEntry> flatten(SnapshotNode node) {
        return flatten(node, "");
    }

    public List<FlatEntry> flatten(SnapshotNode node, String prefix) {
        List<FlatEntry> entries = new ArrayList<>();
        collect(node, prefix == null ? "" : prefix, entries);
        return entries;
    }

    public Map<String, String> flattenToMap(SnapshotNode node) {
        Map<String, String> flat = new LinkedHashMap<>();
        for (FlatEntry entry : flatten(node)) {
            flat.put(entry.path(), entry.value());
        }
        return flat;
    }

    private void collect(SnapshotNode node, String prefix, List<FlatEntry> sink) {
        switch (node.kind()) {
            case MAP -> {
                for (Map.Entry<String, SnapshotNode> entry : ((SnapshotNode.Tree) node).entries().entrySet()) {
                    collect(entry.getValue(), SnapshotPath.child(prefix, entry.getKey()), sink);
                }
            }
            case SEQUENCE -> {
                List<SnapshotNode> items = ((SnapshotNode.Sequence) node).items();
                for (int i = 0; i < items.size(); i++) {
                    collect(items.get(i), SnapshotPath.index(prefix, i), sink);
                }
            }
            case TEXT, NUMBER, BOOLEAN, NULL -> sink.add(new FlatEntry(SnapshotPath.leaf(prefix), node.asText()));
        }
    }
}
