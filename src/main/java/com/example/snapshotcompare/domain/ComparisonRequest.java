package com.example.snapshotcompare.domain;

import java.util.Objects;

public record ComparisonRequest(SnapshotInput baseline, SnapshotInput current) {
    public ComparisonRequest {
        Objects.requireNonNull(baseline, "baseline");
        Objects.requireNonNull(current, "current");
    }
}
