package com.example.snapshotcompare.domain;

import java.io.IOException;

public class SnapshotLoadException extends IOException {
    public SnapshotLoadException(String message) {
        super(message);
    }

    public SnapshotLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
