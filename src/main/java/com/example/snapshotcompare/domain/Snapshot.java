package com.example.snapshotcompare.domain;

import java.util.Objects;

public record Snapshot(String identifier, SnapshotFormat format, SnapshotNode root) {
    public Snapshot {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(root, "root");
    }
}
