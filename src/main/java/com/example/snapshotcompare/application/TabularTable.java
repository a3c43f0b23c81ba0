package com.example.snapshotcompare.application;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public record TabularTable(List<String> header, List<Map<String, String>> rows) {
    public TabularTable {
        header = List.copyOf(header);
        rows = List.copyOf(rows);
    }

    public Optional<String> column(String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        return header.stream()
                .filter(candidate -> candidate.trim().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    public Optional<String> firstColumn(List<String> names) {
        for (String name : names) {
            Optional<String> column = column(name);
            if (column.isPresent()) {
                return column;
            }
        }
        return Optional.empty();
    }

    public static String cell(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null ? "" : value;
    }

    // the header is line 1
    public static int lineOf(int rowIndex) {
        return rowIndex + 2;
    }
}
