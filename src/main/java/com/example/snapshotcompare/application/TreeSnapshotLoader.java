package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.MalformedSnapshotException;
import com.example.snapshotcompare.domain.SnapshotAccessException;
import com.example.snapshotcompare.domain.SnapshotFormat;
import com.example.snapshotcompare.domain.SnapshotLoadException;
import com.example.snapshotcompare.domain.SnapshotNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class TreeSnapshotLoader implements SnapshotLoader {
    private final ObjectMapper objectMapper;

    public TreeSnapshotLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public SnapshotFormat format() {
        return SnapshotFormat.JSON;
    }

    @Override
    public SnapshotNode load(InputStream inputStream, String source) throws SnapshotLoadException {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(inputStream);
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException(
                    "Invalid JSON in " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SnapshotAccessException("Failed to read " + source + ": " + e.getMessage(), e);
        }
        if (tree == null || tree instanceof MissingNode) {
            throw new MalformedSnapshotException("No JSON content in " + source);
        }
        return fromJson(tree);
    }

    public static SnapshotNode fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return SnapshotNode.nullValue();
        }
        if (node.isObject()) {
            Map<String, SnapshotNode> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromJson(field.getValue()));
            }
            return new SnapshotNode.Tree(entries);
        }
        if (node.isArray()) {
            List<SnapshotNode> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromJson(item));
            }
            return new SnapshotNode.Sequence(items);
        }
        if (node.isNumber()) {
            return SnapshotNode.number(node.decimalValue());
        }
        if (node.isBoolean()) {
            return SnapshotNode.bool(node.booleanValue());
        }
        return SnapshotNode.text(node.asText());
    }
}
