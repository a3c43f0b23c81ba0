package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.Snapshot;
import com.example.snapshotcompare.domain.SnapshotAccessException;
import com.example.snapshotcompare.domain.SnapshotFormat;
import com.example.snapshotcompare.domain.SnapshotInput;
import com.example.snapshotcompare.domain.SnapshotLoadException;
import com.example.snapshotcompare.domain.SnapshotNode;
import com.example.snapshotcompare.domain.UnsupportedFormatException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class SnapshotReader {
    private final Map<SnapshotFormat, SnapshotLoader> loaders = new EnumMap<>(SnapshotFormat.class);

    public SnapshotReader(List<SnapshotLoader> loaders) {
        for (SnapshotLoader loader : loaders) {
            this.loaders.put(loader.format(), loader);
        }
    }

    public Snapshot read(SnapshotInput input) throws SnapshotLoadException {
        SnapshotFormat format = SnapshotFormat.fromFilename(input.filename());
        SnapshotLoader loader = loaders.get(format);
        if (loader == null) {
            throw new UnsupportedFormatException(format.extension());
        }
        SnapshotNode root;
        try (InputStream inputStream = input.openStream()) {
            root = loader.load(inputStream, input.filename());
        } catch (SnapshotLoadException e) {
            throw e;
        } catch (NoSuchFileException e) {
            throw new SnapshotAccessException("File not found: " + input.filename(), e);
        } catch (AccessDeniedException e) {
            throw new SnapshotAccessException("Permission denied: " + input.filename(), e);
        } catch (IOException e) {
            throw new SnapshotAccessException(
                    "Failed to read " + input.filename() + ": " + e.getMessage(), e);
        }
        return new Snapshot(input.filename(), format, root);
    }
}
