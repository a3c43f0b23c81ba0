package com.example.snapshotcompare.domain;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A value inside a snapshot: one of four scalar kinds, an insertion-ordered map, or an
 * ordered sequence. Instances are immutable.
 */
public sealed interface SnapshotNode {

    NodeKind kind();

    default String asText() {
        throw new IllegalStateException(kind() + " node has no scalar form");
    }

    static SnapshotNode text(String value) {
        return value == null ? Null.INSTANCE : new Text(value);
    }

    static SnapshotNode number(BigDecimal value) {
        return value == null ? Null.INSTANCE : new Numeric(value);
    }

    static SnapshotNode number(long value) {
        return new Numeric(BigDecimal.valueOf(value));
    }

    static SnapshotNode bool(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static SnapshotNode nullValue() {
        return Null.INSTANCE;
    }

    static Tree emptyTree() {
        return new Tree(Map.of());
    }

    enum NodeKind {
        TEXT,
        NUMBER,
        BOOLEAN,
        NULL,
        MAP,
        SEQUENCE;

        public boolean isScalar() {
            return this != MAP && this != SEQUENCE;
        }
    }

    record Text(String value) implements SnapshotNode {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TEXT;
        }

        @Override
        public String asText() {
            return value;
        }
    }

    /** Numbers compare by value, so {@code 4} equals {@code 4.0}; the source scale is kept for rendering. */
    record Numeric(BigDecimal value) implements SnapshotNode {
        public Numeric {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NUMBER;
        }

        @Override
        public String asText() {
            return value.toPlainString();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Numeric numeric && value.compareTo(numeric.value) == 0;
        }

        @Override
        public int hashCode() {
            return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
        }
    }

    record Bool(boolean value) implements SnapshotNode {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public NodeKind kind() {
            return NodeKind.BOOLEAN;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record Null() implements SnapshotNode {
        static final Null INSTANCE = new Null();

        @Override
        public NodeKind kind() {
            return NodeKind.NULL;
        }

        @Override
        public String asText() {
            return "";
        }
    }

    record Tree(Map<String, SnapshotNode> entries) implements SnapshotNode {
        public Tree {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MAP;
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        public SnapshotNode get(String key) {
            return entries.get(key);
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }
    }

    record Sequence(List<SnapshotNode> items) implements SnapshotNode {
        public Sequence {
            items = List.copyOf(items);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SEQUENCE;
        }
    }
}
