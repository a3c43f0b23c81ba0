package com.example.snapshotcompare.domain;

import java.util.Objects;

/**
 * Value of a {@code changed} entry: either an actual modification or the synthetic error
 * placeholder of a failed comparison.
 */
public sealed interface ChangeEntry {

    record Modified(SnapshotNode from, SnapshotNode to) implements ChangeEntry {
        public Modified {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    record Failure(String message) implements ChangeEntry {
        public Failure {
            Objects.requireNonNull(message, "message");
        }
    }
}
