package com.example.snapshotcompare.application;

import java.util.List;

public interface DiffRenderer {
    String render(
            String baselineName,
            String currentName,
            List<String> baselineLines,
            List<String> currentLines,
            int contextSize);
}
