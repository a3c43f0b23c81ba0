package com.example.snapshotcompare.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SnapshotDiff(
        Map<String, SnapshotNode> added,
        Map<String, SnapshotNode> removed,
        Map<String, ChangeEntry.Modified> changed) {

    public SnapshotDiff {
        added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
        removed = Collections.unmodifiableMap(new LinkedHashMap<>(removed));
        changed = Collections.unmodifiableMap(new LinkedHashMap<>(changed));
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
    }
}
