package com.example.snapshotcompare.domain;

import java.util.Locale;

public enum SnapshotFormat {
    JSON("json", "application/json"),
    CSV("csv", "text/csv");

    private final String extension;
    private final String mediaType;

    SnapshotFormat(String extension, String mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String extension() {
        return extension;
    }

    public String mediaType() {
        return mediaType;
    }

    public static SnapshotFormat fromFilename(String filename) throws UnsupportedFormatException {
        String extension = extensionOf(filename);
        for (SnapshotFormat format : values()) {
            if (format.extension.equals(extension)) {
                return format;
            }
        }
        throw new UnsupportedFormatException(extension);
    }

    public static SnapshotFormat fromName(String name) throws UnsupportedFormatException {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (SnapshotFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new UnsupportedFormatException(normalized);
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int lastSeparator = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        int lastDot = filename.lastIndexOf('.');
        if (lastDot > lastSeparator) {
            return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }
}
