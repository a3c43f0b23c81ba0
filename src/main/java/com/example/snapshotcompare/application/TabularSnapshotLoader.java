package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.MalformedSnapshotException;
import com.example.snapshotcompare.domain.SnapshotAccessException;
import com.example.snapshotcompare.domain.SnapshotFormat;
import com.example.snapshotcompare.domain.SnapshotLoadException;
import com.example.snapshotcompare.domain.SnapshotNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class TabularSnapshotLoader implements SnapshotLoader {
    private static final TypeReference<Map<String, String>> ROW_TYPE = new TypeReference<>() {};

    private final CsvMapper csvMapper;
    private final StructuredTabularLoad structuredLoad;
    private final FallbackFlattenLoad fallbackLoad;

    public TabularSnapshotLoader(CsvMapper csvMapper) {
        this(csvMapper, new StructuredTabularLoad(), new FallbackFlattenLoad());
    }

    TabularSnapshotLoader(
            CsvMapper csvMapper, StructuredTabularLoad structuredLoad, FallbackFlattenLoad fallbackLoad) {
        this.csvMapper = csvMapper;
        this.structuredLoad = structuredLoad;
        this.fallbackLoad = fallbackLoad;
    }

    @Override
    public SnapshotFormat format() {
        return SnapshotFormat.CSV;
    }

    @Override
    public SnapshotNode load(InputStream inputStream, String source) throws SnapshotLoadException {
        TabularTable table = readTable(inputStream, source);
        if (table.header().isEmpty()) {
            throw new MalformedSnapshotException("No CSV header in " + source);
        }
        return structuredLoad.tryLoad(table, source).orElseGet(() -> fallbackLoad.load(table));
    }

    TabularTable readTable(InputStream inputStream, String source) throws SnapshotLoadException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> iterator =
                csvMapper
                        .readerFor(ROW_TYPE)
                        .with(schema)
                        .with(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                        .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                        .readValues(inputStream)) {
            List<Map<String, String>> rows = new ArrayList<>();
            while (iterator.hasNextValue()) {
                rows.add(iterator.nextValue());
            }
            CsvSchema parsed = (CsvSchema) iterator.getParserSchema();
            List<String> header = new ArrayList<>();
            if (parsed != null) {
                parsed.forEach(column -> header.add(column.getName()));
            }
            return new TabularTable(header, rows);
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException(
                    "Invalid CSV in " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SnapshotAccessException("Failed to read " + source + ": " + e.getMessage(), e);
        }
    }
}
