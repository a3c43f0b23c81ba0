package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.ChangeEntry;
import com.example.snapshotcompare.domain.DiffResult;
import com.example.snapshotcompare.domain.DiffSummary;
import com.example.snapshotcompare.domain.SnapshotDiff;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

@Component
public class DiffSummaryBuilder {

    public DiffResult build(SnapshotDiff diff, String baselineFile, String currentFile) {
        DiffSummary summary =
                new DiffSummary(
                        diff.added().size(),
                        diff.removed().size(),
                        diff.changed().size(),
                        baselineFile,
                        currentFile,
                        null);
        return new DiffResult(
                diff.added(), diff.removed(), new LinkedHashMap<String, ChangeEntry>(diff.changed()), summary);
    }
}
