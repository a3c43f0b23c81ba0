package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.DiffResult;
import com.example.snapshotcompare.domain.DiffSummary;
import com.example.snapshotcompare.infrastructure.persistence.StoredComparisonResult;
import com.example.snapshotcompare.infrastructure.persistence.StoredComparisonResultRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.Objects;

@Service
public class ComparisonResultPersistenceService {
    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;

    private final StoredComparisonResultRepository repository;
    private final ObjectMapper objectMapper;

    public ComparisonResultPersistenceService(
            StoredComparisonResultRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public long saveComparison(String name, String ipRequest, DiffResult result) {
        StoredComparisonResult entity = new StoredComparisonResult();
        entity.setName(name);
        entity.setIpRequest(ipRequest);
        entity.setDiffResultJson(toJson(result));
        DiffSummary summary = result.summary();
        entity.setTotalAdded(summary.totalAdded());
        entity.setTotalRemoved(summary.totalRemoved());
        entity.setTotalChanged(summary.totalChanged());
        entity.setFailed(result.isFailure());
        StoredComparisonResult saved = repository.save(entity);
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public StoredComparisonResultView loadComparison(long id) {
        StoredComparisonResult entity = findOrThrow(id);
        return new StoredComparisonResultView(
                entity.getId(),
                entity.getName(),
                entity.getIpRequest(),
                entity.getCreated(),
                fromJson(entity.getDiffResultJson()));
    }

    @Transactional(readOnly = true)
    public Page<StoredComparisonResultSummary> searchComparisons(
            String nameFilter, String ipFilter, int page, int size) {
        Pageable pageable =
                PageRequest.of(sanitizePage(page), sanitizeSize(size), Sort.by(Sort.Direction.DESC, "created"));

        return repository
                .findByNameContainingIgnoreCaseAndIpRequestContainingIgnoreCase(
                        sanitizeFilter(nameFilter), sanitizeFilter(ipFilter), pageable)
                .map(
                        result ->
                                new StoredComparisonResultSummary(
                                        result.getId(),
                                        result.getName(),
                                        result.getIpRequest(),
                                        result.getCreated(),
                                        result.getTotalAdded(),
                                        result.getTotalRemoved(),
                                        result.getTotalChanged(),
                                        result.isFailed()));
    }

    @Transactional
    public void renameComparison(long id, String requesterIp, String name) {
        StoredComparisonResult entity = findOrThrow(id);
        if (!Objects.equals(entity.getIpRequest(), requesterIp)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Not allowed to edit this comparison");
        }
        String sanitizedName = name == null ? "" : name.trim();
        if (sanitizedName.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Name cannot be empty");
        }
        entity.setName(sanitizedName);
    }

    private StoredComparisonResult findOrThrow(long id) {
        return repository
                .findById(id)
                .orElseThrow(
                        () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Comparison not found"));
    }

    private String toJson(DiffResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            throw new ResponseStatusException(
                    HttpStatus.INTERNAL_SERVER_ERROR, "Failed to store comparison result", ex);
        }
    }

    private DiffResult fromJson(String json) {
        try {
            return objectMapper.readValue(json, DiffResult.class);
        } catch (JsonProcessingException ex) {
            throw new ResponseStatusException(
                    HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read comparison result", ex);
        }
    }

    private static String sanitizeFilter(String filter) {
        return filter == null ? "" : filter.trim();
    }

    private static int sanitizePage(int page) {
        return Math.max(0, page);
    }

    private static int sanitizeSize(int size) {
        if (size <= 0) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(size, MAX_PAGE_SIZE);
    }

    public record StoredComparisonResultView(
            Long id, String name, String ipRequest, LocalDateTime created, DiffResult result) {}

    public record StoredComparisonResultSummary(
            Long id,
            String name,
            String ipRequest,
            LocalDateTime created,
            int totalAdded,
            int totalRemoved,
            int totalChanged,
            boolean failed) {}
}
