package com.example.snapshotcompare.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SnapshotFormatTest {

    @Test
    void detectsFormatFromExtension() throws Exception {
        assertEquals(SnapshotFormat.JSON, SnapshotFormat.fromFilename("/tmp/specs.JSON"));
        assertEquals(SnapshotFormat.CSV, SnapshotFormat.fromFilename("C:\\exports\\usage.csv"));
    }

    @Test
    void unknownExtensionIsNamedInMessage() {
        assertThatThrownBy(() -> SnapshotFormat.fromFilename("notes.txt"))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessage("Unsupported file type: .txt")
                .extracting(e -> ((UnsupportedFormatException) e).getExtension())
                .isEqualTo("txt");
    }

    @Test
    void missingExtensionIsUnsupported() {
        assertThatThrownBy(() -> SnapshotFormat.fromFilename("dir.v2/specs"))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining("no extension");
    }

    @Test
    void parsesFormatNames() throws Exception {
        assertEquals(SnapshotFormat.CSV, SnapshotFormat.fromName(" .CSV "));
        assertEquals(SnapshotFormat.JSON, SnapshotFormat.fromName("json"));
    }
}
