package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.FlatEntry;
import com.example.snapshotcompare.domain.SnapshotFormat;
import com.example.snapshotcompare.domain.SnapshotInput;
import com.example.snapshotcompare.domain.SnapshotNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class SnapshotExportService {
    private static final Logger log = LogManager.getLogger(SnapshotExportService.class);

    static final String COMPONENT = "Component";
    static final String PROPERTY = "Property";
    static final String KEY = "Key";
    static final String VALUE = "Value";

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'_'HH-mm-ss");

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;
    private final SnapshotFlattener flattener;
    private final SnapshotReader snapshotReader;
    private final Path exportDirectory;
    private final Clock clock;

    @Autowired
    public SnapshotExportService(
            ObjectMapper objectMapper,
            CsvMapper csvMapper,
            SnapshotFlattener flattener,
            SnapshotReader snapshotReader,
            @Value("${snapshot.export.directory:.}") String exportDirectory) {
        this(objectMapper, csvMapper, flattener, snapshotReader, Path.of(exportDirectory), Clock.systemDefaultZone());
    }

    SnapshotExportService(
            ObjectMapper objectMapper,
            CsvMapper csvMapper,
            SnapshotFlattener flattener,
            SnapshotReader snapshotReader,
            Path exportDirectory,
            Clock clock) {
        this.objectMapper = objectMapper;
        this.csvMapper = csvMapper;
        this.flattener = flattener;
        this.snapshotReader = snapshotReader;
        this.exportDirectory = exportDirectory;
        this.clock = clock;
    }

    public String render(SnapshotNode root, SnapshotFormat format) {
        try {
            return switch (format) {
                case JSON -> objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
                case CSV -> toCsv(root);
            };
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render snapshot as " + format, e);
        }
    }

    public String convert(SnapshotInput input, SnapshotFormat target) throws IOException {
        return render(snapshotReader.read(input).root(), target);
    }

    public Path export(SnapshotNode root, SnapshotFormat format) throws IOException {
        Files.createDirectories(exportDirectory);
        String timestamp = LocalDateTime.now(clock).format(FILE_TIMESTAMP);
        Path target = exportDirectory.resolve("snapshot_export_" + timestamp + "." + format.extension());
        Files.writeString(target, render(root, format), StandardCharsets.UTF_8);
        log.info("Exported snapshot as {} to {}", format, target.toAbsolutePath());
        return target;
    }

    private String toCsv(SnapshotNode root) throws JsonProcessingException {
        if (isComponentTable(root)) {
            return writeCsv(List.of(COMPONENT, PROPERTY, VALUE), componentRows((SnapshotNode.Tree) root));
        }
        List<Map<String, String>> rows = new ArrayList<>();
        for (FlatEntry entry : flattener.flatten(root)) {
            rows.add(row(KEY, entry.path(), VALUE, entry.value()));
        }
        return writeCsv(List.of(KEY, VALUE), rows);
    }

    static boolean isComponentTable(SnapshotNode root) {
        if (!(root instanceof SnapshotNode.Tree tree) || tree.isEmpty()) {
            return false;
        }
        return tree.entries().values().stream().noneMatch(value -> value.kind().isScalar());
    }

    private List<Map<String, String>> componentRows(SnapshotNode.Tree root) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (Map.Entry<String, SnapshotNode> component : root.entries().entrySet()) {
            for (FlatEntry entry : flattener.flatten(component.getValue())) {
                Map<String, String> row = new LinkedHashMap<>();
                row.put(COMPONENT, component.getKey());
                row.put(PROPERTY, entry.path());
                row.put(VALUE, entry.value());
                rows.add(row);
            }
        }
        return rows;
    }

    private String writeCsv(List<String> columns, List<Map<String, String>> rows)
            throws JsonProcessingException {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        columns.forEach(schema::addColumn);
        if (rows.isEmpty()) {
            return String.join(",", columns) + "\n";
        }
        return csvMapper.writer(schema.build()).writeValueAsString(rows);
    }

    private static Map<String, String> row(String firstColumn, String first, String secondColumn, String second) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(firstColumn, first);
        row.put(secondColumn, second);
        return row;
    }
}
