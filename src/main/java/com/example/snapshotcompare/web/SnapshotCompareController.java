package com.example.snapshotcompare.web;

import com.example.snapshotcompare.application.ComparisonResultPersistenceService;
import com.example.snapshotcompare.application.SnapshotCollector;
import com.example.snapshotcompare.application.SnapshotComparisonUseCase;
import com.example.snapshotcompare.application.SnapshotExportService;
import com.example.snapshotcompare.domain.ComparisonRequest;
import com.example.snapshotcompare.domain.DiffResult;
import com.example.snapshotcompare.domain.SnapshotComponent;
import com.example.snapshotcompare.domain.SnapshotFormat;
import com.example.snapshotcompare.domain.SnapshotLoadException;
import com.example.snapshotcompare.domain.SnapshotNode;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api")
public class SnapshotCompareController {
    private final SnapshotComparisonUseCase comparisonUseCase;
    private final MultipartSnapshotInputAdapter inputAdapter;
    private final ComparisonResultPersistenceService persistenceService;
    private final SnapshotExportService exportService;
    private final SnapshotCollector snapshotCollector;

    public SnapshotCompareController(
            SnapshotComparisonUseCase comparisonUseCase,
            MultipartSnapshotInputAdapter inputAdapter,
            ComparisonResultPersistenceService persistenceService,
            SnapshotExportService exportService,
            SnapshotCollector snapshotCollector) {
        this.comparisonUseCase = comparisonUseCase;
        this.inputAdapter = inputAdapter;
        this.persistenceService = persistenceService;
        this.exportService = exportService;
        this.snapshotCollector = snapshotCollector;
    }

    @PostMapping("/comparisons")
    public SavedComparison compare(
            @RequestParam("baseline") MultipartFile baseline,
            @RequestParam("current") MultipartFile current,
            HttpServletRequest httpRequest) {
        DiffResult result = comparisonUseCase.compare(toRequest(baseline, current));
        long id =
                persistenceService.saveComparison(
                        inputAdapter.describe(baseline, current), httpRequest.getRemoteAddr(), result);
        return new SavedComparison(id, result);
    }

    @GetMapping("/comparisons")
    public Page<ComparisonResultPersistenceService.StoredComparisonResultSummary> search(
            @RequestParam(name = "name", required = false) String nameFilter,
            @RequestParam(name = "ip", required = false) String ipFilter,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size) {
        return persistenceService.searchComparisons(nameFilter, ipFilter, page, size);
    }

    @GetMapping("/comparisons/{id}")
    public ComparisonResultPersistenceService.StoredComparisonResultView viewComparison(
            @PathVariable("id") long id) {
        return persistenceService.loadComparison(id);
    }

    @PatchMapping("/comparisons/{id}")
    public ResponseEntity<Void> renameComparison(
            @PathVariable("id") long id,
            @RequestBody RenameComparisonRequest body,
            HttpServletRequest httpRequest) {
        persistenceService.renameComparison(id, httpRequest.getRemoteAddr(), body.getName());
        return ResponseEntity.noContent().build();
    }

    @PostMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String report(
            @RequestParam("baseline") MultipartFile baseline,
            @RequestParam("current") MultipartFile current,
            @RequestParam(name = "contextSize", required = false) Integer contextSize) {
        try {
            return comparisonUseCase.report(toRequest(baseline, current), contextSize);
        } catch (SnapshotLoadException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @PostMapping("/convert")
    public ResponseEntity<String> convert(
            @RequestParam("file") MultipartFile file, @RequestParam("to") String targetFormat) {
        SnapshotFormat format = parseFormat(targetFormat);
        try {
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(format.mediaType()))
                    .body(exportService.convert(inputAdapter.adapt(file), format));
        } catch (SnapshotLoadException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        }
    }

    @GetMapping("/snapshot")
    public ResponseEntity<String> snapshot(
            @RequestParam(name = "format", defaultValue = "json") String format,
            @RequestParam(name = "components", required = false) List<String> components) {
        SnapshotFormat snapshotFormat = parseFormat(format);
        SnapshotNode.Tree snapshot = snapshotCollector.collect(parseComponents(components));
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(snapshotFormat.mediaType()))
                .body(exportService.render(snapshot, snapshotFormat));
    }

    @PostMapping("/snapshot/export")
    public ExportedSnapshot exportSnapshot(
            @RequestParam(name = "format", defaultValue = "json") String format,
            @RequestParam(name = "components", required = false) List<String> components) {
        SnapshotFormat snapshotFormat = parseFormat(format);
        try {
            Path path = exportService.export(snapshotCollector.collect(parseComponents(components)), snapshotFormat);
            return new ExportedSnapshot(path.toAbsolutePath().toString());
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Export failed", e);
        }
    }

    private ComparisonRequest toRequest(MultipartFile baseline, MultipartFile current) {
        return new ComparisonRequest(inputAdapter.adapt(baseline), inputAdapter.adapt(current));
    }

    private static SnapshotFormat parseFormat(String value) {
        try {
            return SnapshotFormat.fromName(value);
        } catch (SnapshotLoadException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    private static Set<SnapshotComponent> parseComponents(List<String> components) {
        Set<SnapshotComponent> parsed = EnumSet.noneOf(SnapshotComponent.class);
        if (components == null) {
            return parsed;
        }
        for (String component : components) {
            try {
                parsed.add(SnapshotComponent.parse(component));
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(
                        HttpStatus.BAD_REQUEST, "Unknown component: " + component, e);
            }
        }
        return parsed;
    }

    public record SavedComparison(long id, DiffResult result) {}

    public record ExportedSnapshot(String path) {}
}
