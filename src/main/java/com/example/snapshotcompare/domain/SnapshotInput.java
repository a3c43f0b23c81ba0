package com.example.snapshotcompare.domain;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Snapshot source in a framework-agnostic way: a file name (used for format detection and
 * provenance) and a way to open its content.
 */
public class SnapshotInput {
    private final String filename;
    private final InputStreamSupplier inputStreamSupplier;

    public SnapshotInput(String filename, InputStreamSupplier inputStreamSupplier) {
        this.filename = filename != null ? filename : "";
        this.inputStreamSupplier = Objects.requireNonNull(inputStreamSupplier, "inputStreamSupplier");
    }

    public static SnapshotInput ofPath(Path path) {
        return new SnapshotInput(path.toString(), () -> Files.newInputStream(path));
    }

    public String filename() {
        return filename;
    }

    public InputStream openStream() throws IOException {
        return inputStreamSupplier.openStream();
    }

    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream openStream() throws IOException;
    }
}
