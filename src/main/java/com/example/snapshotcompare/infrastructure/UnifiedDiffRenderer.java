package com.example.snapshotcompare.infrastructure;

import com.example.snapshotcompare.application.DiffRenderer;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class UnifiedDiffRenderer implements DiffRenderer {
    static final String NO_DIFFERENCES_MESSAGE = "No differences found.";

    @Override
    public String render(
            String baselineName,
            String currentName,
            List<String> baselineLines,
            List<String> currentLines,
            int contextSize) {
        Patch<String> patch = DiffUtils.diff(baselineLines, currentLines);
        List<String> unified =
                UnifiedDiffUtils.generateUnifiedDiff(
                        baselineName, currentName, baselineLines, patch, Math.max(0, contextSize));
        if (unified.isEmpty()) {
            unified =
                    List.of(
                            String.format("--- %s", baselineName),
                            String.format("+++ %s", currentName),
                            "@@ -0,0 +0,0 @@",
                            " " + NO_DIFFERENCES_MESSAGE);
        }
        return String.join(System.lineSeparator(), unified) + System.lineSeparator();
    }
}
