package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.SnapshotComponent;
import com.example.snapshotcompare.domain.SnapshotNode;

import java.util.Set;

public interface SnapshotCollector {
    SnapshotNode.Tree collect(Set<SnapshotComponent> components);
}
