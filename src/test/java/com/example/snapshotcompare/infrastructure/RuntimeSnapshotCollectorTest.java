package com.example.snapshotcompare.infrastructure;

import com.example.snapshotcompare.domain.SnapshotComponent;
import com.example.snapshotcompare.domain.SnapshotNode;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuntimeSnapshotCollectorTest {

    private final RuntimeSnapshotCollector collector = new RuntimeSnapshotCollector();

    @Test
    void emptySelectionCollectsEveryComponent() {
        SnapshotNode.Tree snapshot = collector.collect(Set.of());

        assertThat(snapshot.entries().keySet()).containsExactly("OS", "CPU", "Memory", "Disk");
        assertEquals(SnapshotNode.NodeKind.SEQUENCE, snapshot.get("Disk").kind());
    }

    @Test
    void collectsOnlyRequestedComponents() {
        SnapshotNode.Tree snapshot = collector.collect(EnumSet.of(SnapshotComponent.CPU));

        assertThat(snapshot.entries()).containsOnlyKeys("CPU");
        SnapshotNode cores = ((SnapshotNode.Tree) snapshot.get("CPU")).get("logicalCores");
        assertTrue(((SnapshotNode.Numeric) cores).value().intValue() >= 1);
    }
}
