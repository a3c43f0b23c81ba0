package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.MalformedSnapshotException;
import com.example.snapshotcompare.domain.SnapshotNode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TreeSnapshotLoaderTest {

    private final TreeSnapshotLoader loader = new TreeSnapshotLoader(SnapshotFixtures.OBJECT_MAPPER);

    @Test
    void keepsNativeScalarTypes() throws Exception {
        SnapshotNode.Tree root =
                (SnapshotNode.Tree) load("{\"cores\": 8, \"load\": 1.25, \"ssd\": true, \"gpu\": null, \"os\": \"Linux\"}");

        assertEquals(SnapshotNode.NodeKind.NUMBER, root.get("cores").kind());
        assertEquals(new BigDecimal("1.25"), ((SnapshotNode.Numeric) root.get("load")).value());
        assertEquals(SnapshotNode.bool(true), root.get("ssd"));
        assertEquals(SnapshotNode.nullValue(), root.get("gpu"));
        assertEquals(SnapshotNode.text("Linux"), root.get("os"));
    }

    @Test
    void preservesKeyOrderAndSequences() throws Exception {
        SnapshotNode.Tree root = (SnapshotNode.Tree) load("{\"z\": 1, \"a\": [1, {\"b\": 2}], \"m\": {}}");

        assertThat(root.entries().keySet()).containsExactly("z", "a", "m");
        SnapshotNode.Sequence sequence = (SnapshotNode.Sequence) root.get("a");
        assertThat(sequence.items()).hasSize(2);
        assertEquals(SnapshotNode.NodeKind.MAP, sequence.items().get(1).kind());
    }

    @Test
    void acceptsNonObjectRoots() throws Exception {
        assertEquals(SnapshotNode.NodeKind.SEQUENCE, load("[1, 2]").kind());
        assertEquals(SnapshotNode.text("x"), load("\"x\""));
    }

    @Test
    void invalidJsonIsMalformed() {
        assertThatThrownBy(() -> load("{\"cores\": "))
                .isInstanceOf(MalformedSnapshotException.class)
                .hasMessageContaining("specs.json");
    }

    @Test
    void emptyInputIsMalformed() {
        assertThatThrownBy(() -> load("")).isInstanceOf(MalformedSnapshotException.class);
    }

    private SnapshotNode load(String json) throws Exception {
        return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "specs.json");
    }
}
