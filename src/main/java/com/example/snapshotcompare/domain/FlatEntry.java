package com.example.snapshotcompare.domain;

import java.util.Objects;

public record FlatEntry(String path, String value) {
    public FlatEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(value, "value");
    }

    public String toLine() {
        return path + " = " + value;
    }
}
