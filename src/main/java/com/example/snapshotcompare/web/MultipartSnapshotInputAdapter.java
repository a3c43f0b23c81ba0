package com.example.snapshotcompare.web;

import com.example.snapshotcompare.domain.SnapshotInput;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

@Component
public class MultipartSnapshotInputAdapter {
    static final String DEFAULT_NAME = "upload";

    public SnapshotInput adapt(MultipartFile file) {
        if (file == null) {
            throw new IllegalArgumentException("File must not be null");
        }
        return new SnapshotInput(determineName(file), file::getInputStream);
    }

    public String describe(MultipartFile baseline, MultipartFile current) {
        return String.format("%s vs %s", determineName(baseline), determineName(current));
    }

    private String determineName(MultipartFile file) {
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || originalFilename.isBlank()) {
            return DEFAULT_NAME;
        }
        String normalized = originalFilename.trim().replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
