package com.example.snapshotcompare.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of comparing two snapshots. Every path appears in at most one category.
 */
@JsonPropertyOrder({"added", "removed", "changed", "summary"})
public record DiffResult(
        Map<String, SnapshotNode> added,
        Map<String, SnapshotNode> removed,
        Map<String, ChangeEntry> changed,
        DiffSummary summary) {

    public static final String ERROR_KEY = "error";

    public DiffResult {
        added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
        removed = Collections.unmodifiableMap(new LinkedHashMap<>(removed));
        changed = Collections.unmodifiableMap(new LinkedHashMap<>(changed));
    }

    public static DiffResult failure(String message, String baselineFile, String currentFile) {
        return new DiffResult(
                Map.of(ERROR_KEY, SnapshotNode.text(message)),
                Map.of(ERROR_KEY, SnapshotNode.text(message)),
                Map.of(ERROR_KEY, new ChangeEntry.Failure(message)),
                new DiffSummary(0, 0, 0, baselineFile, currentFile, message));
    }

    @JsonIgnore
    public boolean isFailure() {
        return summary != null && summary.failed();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
    }
}
