package com.example.snapshotcompare.domain;

public class SnapshotAccessException extends SnapshotLoadException {
    public SnapshotAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
