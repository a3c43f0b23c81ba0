package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.ComparisonRequest;
import com.example.snapshotcompare.domain.DiffResult;
import com.example.snapshotcompare.domain.FlatEntry;
import com.example.snapshotcompare.domain.Snapshot;
import com.example.snapshotcompare.domain.SnapshotAccessException;
import com.example.snapshotcompare.domain.SnapshotDiff;
import com.example.snapshotcompare.domain.SnapshotInput;
import com.example.snapshotcompare.domain.SnapshotLoadException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

@Service
public class SnapshotComparisonUseCase {
    private static final Logger log = LogManager.getLogger(SnapshotComparisonUseCase.class);

    private final SnapshotReader snapshotReader;
    private final SnapshotDiffEngine diffEngine;
    private final DiffSummaryBuilder summaryBuilder;
    private final SnapshotFlattener flattener;
    private final DiffRenderer diffRenderer;
    private final int defaultContextSize;

    public SnapshotComparisonUseCase(
            SnapshotReader snapshotReader,
            SnapshotDiffEngine diffEngine,
            DiffSummaryBuilder summaryBuilder,
            SnapshotFlattener flattener,
            DiffRenderer diffRenderer,
            @Value("${snapshot.report.context-size:3}") int defaultContextSize) {
        this.snapshotReader = snapshotReader;
        this.diffEngine = diffEngine;
        this.summaryBuilder = summaryBuilder;
        this.flattener = flattener;
        this.diffRenderer = diffRenderer;
        this.defaultContextSize = Math.max(0, defaultContextSize);
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    public DiffResult compare(Path baseline, Path current) {
        return compare(new ComparisonRequest(SnapshotInput.ofPath(baseline), SnapshotInput.ofPath(current)));
    }

    public DiffResult compare(ComparisonRequest request) {
        String baselineName = request.baseline().filename();
        String currentName = request.current().filename();
        try {
            long loadStart = System.nanoTime();
            Snapshot baseline = snapshotReader.read(request.baseline());
            log.info("Loaded baseline {} ({}) in {}s", baselineName, baseline.format(), secondsSince(loadStart));

            loadStart = System.nanoTime();
            Snapshot current = snapshotReader.read(request.current());
            log.info("Loaded current {} ({}) in {}s", currentName, current.format(), secondsSince(loadStart));

            long diffStart = System.nanoTime();
            SnapshotDiff diff = diffEngine.diff(baseline.root(), current.root());
            DiffResult result = summaryBuilder.build(diff, baselineName, currentName);
            log.info(
                    "Compared {} with {} in {}s: {} added, {} removed, {} changed",
                    baselineName,
                    currentName,
                    secondsSince(diffStart),
                    result.summary().totalAdded(),
                    result.summary().totalRemoved(),
                    result.summary().totalChanged());
            return result;
        } catch (SnapshotAccessException e) {
            log.warn("Comparison of {} and {} aborted: {}", baselineName, currentName, e.getMessage());
            return DiffResult.failure(e.getMessage(), baselineName, currentName);
        } catch (SnapshotLoadException e) {
            log.warn("Comparison of {} and {} failed: {}", baselineName, currentName, e.getMessage());
            return DiffResult.failure("Comparison failed: " + e.getMessage(), baselineName, currentName);
        } catch (RuntimeException e) {
            log.warn("Unexpected error comparing {} and {}", baselineName, currentName, e);
            return DiffResult.failure("Comparison failed: " + e, baselineName, currentName);
        }
    }

    public String report(ComparisonRequest request, Integer contextSize) throws SnapshotLoadException {
        Snapshot baseline = snapshotReader.read(request.baseline());
        Snapshot current = snapshotReader.read(request.current());
        int effectiveContext = contextSize == null ? defaultContextSize : Math.max(0, contextSize);
        return diffRenderer.render(
                baseline.identifier(),
                current.identifier(),
                toLines(flattener.flatten(baseline.root())),
                toLines(flattener.flatten(current.root())),
                effectiveContext);
    }

    private static List<String> toLines(List<FlatEntry> entries) {
        return entries.stream().map(FlatEntry::toLine).toList();
    }
}
