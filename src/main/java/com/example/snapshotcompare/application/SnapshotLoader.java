package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.SnapshotFormat;
import com.example.snapshotcompare.domain.SnapshotLoadException;
import com.example.snapshotcompare.domain.SnapshotNode;

import java.io.InputStream;

public interface SnapshotLoader {
    SnapshotFormat format();

    SnapshotNode load(InputStream inputStream, String source) throws SnapshotLoadException;
}
