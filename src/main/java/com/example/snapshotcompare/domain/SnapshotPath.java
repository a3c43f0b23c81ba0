package com.example.snapshotcompare.domain;

public final class SnapshotPath {
    public static final String ROOT_VALUE = "value";

    private SnapshotPath() {}

    /**
     * Appends a map key. A key that is already an index segment (as found in tabular
     * properties like {@code [0].size}) is appended without a separating dot.
     */
    public static String child(String prefix, String key) {
        if (prefix == null || prefix.isEmpty()) {
            return key;
        }
        if (key.startsWith("[")) {
            return prefix + key;
        }
        return prefix + "." + key;
    }

    public static String index(String prefix, int index) {
        return (prefix == null ? "" : prefix) + "[" + index + "]";
    }

    public static String leaf(String prefix) {
        return prefix == null || prefix.isEmpty() ? ROOT_VALUE : prefix;
    }
}
