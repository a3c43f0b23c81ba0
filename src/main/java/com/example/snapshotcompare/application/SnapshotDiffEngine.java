package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.ChangeEntry;
import com.example.snapshotcompare.domain.SnapshotDiff;
import com.example.snapshotcompare.domain.SnapshotNode;
import com.example.snapshotcompare.domain.SnapshotPath;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structural diff of two snapshots. Maps present on both sides are walked key by key;
 * anything else is compared as a whole, so a reordered sequence or a map replaced by a
 * scalar is a single {@code changed} entry. A key mapped to null is present; only a
 * missing key counts as added or removed.
 *
 * <p>An added or removed map is reported leaf by leaf ({@code GPU.name}, not {@code GPU});
 * sequences and empty maps are reported as one value at their own path. A path that ends up
 * both removed and added is a single {@code changed} entry, or nothing when the values match.
 */
@Component
public class SnapshotDiffEngine {

    public SnapshotDiff diff(SnapshotNode older, SnapshotNode newer) {
        Map<String, SnapshotNode> added = new LinkedHashMap<>();
        Map<String, SnapshotNode> removed = new LinkedHashMap<>();
        Map<String, ChangeEntry.Modified> changed = new LinkedHashMap<>();
        if (older instanceof SnapshotNode.Tree olderTree && newer instanceof SnapshotNode.Tree newerTree) {
            compareTrees(olderTree, newerTree, "", added, removed, changed);
            reconcileCollisions(added, removed, changed);
        } else if (!older.equals(newer)) {
            changed.put(SnapshotPath.ROOT_VALUE, new ChangeEntry.Modified(older, newer));
        }
        return new SnapshotDiff(added, removed, changed);
    }

    private void compareTrees(
            SnapshotNode.Tree older,
            SnapshotNode.Tree newer,
            String prefix,
            Map<String, SnapshotNode> added,
            Map<String, SnapshotNode> removed,
            Map<String, ChangeEntry.Modified> changed) {
        for (Map.Entry<String, SnapshotNode> entry : older.entries().entrySet()) {
            String key = entry.getKey();
            String currentPath = SnapshotPath.child(prefix, key);
            SnapshotNode olderValue = entry.getValue();
            if (!newer.containsKey(key)) {
                recordSubtree(currentPath, olderValue, removed);
                continue;
            }
            SnapshotNode newerValue = newer.get(key);
            if (olderValue instanceof SnapshotNode.Tree olderChild
                    && newerValue instanceof SnapshotNode.Tree newerChild) {
                compareTrees(olderChild, newerChild, currentPath, added, removed, changed);
            } else if (!olderValue.equals(newerValue)) {
                changed.put(currentPath, new ChangeEntry.Modified(olderValue, newerValue));
            }
        }
        for (Map.Entry<String, SnapshotNode> entry : newer.entries().entrySet()) {
            if (!older.containsKey(entry.getKey())) {
                recordSubtree(SnapshotPath.child(prefix, entry.getKey()), entry.getValue(), added);
            }
        }
    }

    // A dotted key kept whole ("cache.l1") and a nested one can address the same path.
    private void reconcileCollisions(
            Map<String, SnapshotNode> added,
            Map<String, SnapshotNode> removed,
            Map<String, ChangeEntry.Modified> changed) {
        Iterator<Map.Entry<String, SnapshotNode>> iterator = removed.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, SnapshotNode> entry = iterator.next();
            SnapshotNode addedValue = added.remove(entry.getKey());
            if (addedValue == null) {
                continue;
            }
            iterator.remove();
            if (!entry.getValue().equals(addedValue)) {
                changed.put(entry.getKey(), new ChangeEntry.Modified(entry.getValue(), addedValue));
            }
        }
    }

    private void recordSubtree(String path, SnapshotNode node, Map<String, SnapshotNode> sink) {
        if (node instanceof SnapshotNode.Tree tree && !tree.isEmpty()) {
            for (Map.Entry<String, SnapshotNode> entry : tree.entries().entrySet()) {
                recordSubtree(SnapshotPath.child(path, entry.getKey()), entry.getValue(), sink);
            }
            return;
        }
        sink.put(path, node);
    }
}
