package com.example.snapshotcompare.domain;

public class UnsupportedFormatException extends SnapshotLoadException {
    private final String extension;

    public UnsupportedFormatException(String extension) {
        super(String.format(
                "Unsupported file type: %s",
                extension == null || extension.isEmpty() ? "(no extension)" : "." + extension));
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
