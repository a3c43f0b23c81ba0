package com.example.snapshotcompare.domain;

public class MalformedSnapshotException extends SnapshotLoadException {
    public MalformedSnapshotException(String message) {
        super(message);
    }

    public MalformedSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
