package com.example.snapshotcompare.domain;

import java.util.Locale;

public enum SnapshotComponent {
    OS("OS"),
    CPU("CPU"),
    MEMORY("Memory"),
    DISK("Disk");

    private final String label;

    SnapshotComponent(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SnapshotComponent parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("RAM")) {
            return MEMORY;
        }
        return valueOf(normalized);
    }
}
