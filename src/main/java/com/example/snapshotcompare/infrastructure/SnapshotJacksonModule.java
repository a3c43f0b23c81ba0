package com.example.snapshotcompare.infrastructure;

import com.example.snapshotcompare.application.TreeSnapshotLoader;
import com.example.snapshotcompare.domain.ChangeEntry;
import com.example.snapshotcompare.domain.SnapshotNode;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

@Component
public class SnapshotJacksonModule extends SimpleModule {

    public SnapshotJacksonModule() {
        super("SnapshotJacksonModule");
        addSerializer(SnapshotNode.class, new SnapshotNodeSerializer());
        addDeserializer(SnapshotNode.class, new SnapshotNodeDeserializer());
        addSerializer(ChangeEntry.class, new ChangeEntrySerializer());
        addDeserializer(ChangeEntry.class, new ChangeEntryDeserializer());
    }

    static final class SnapshotNodeSerializer extends StdSerializer<SnapshotNode> {
        SnapshotNodeSerializer() {
            super(SnapshotNode.class);
        }

        @Override
        public void serialize(SnapshotNode node, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            switch (node.kind()) {
                case TEXT -> gen.writeString(((SnapshotNode.Text) node).value());
                case NUMBER -> gen.writeNumber(((SnapshotNode.Numeric) node).value());
                case BOOLEAN -> gen.writeBoolean(((SnapshotNode.Bool) node).value());
                case NULL -> gen.writeNull();
                case MAP -> {
                    gen.writeStartObject();
                    for (Map.Entry<String, SnapshotNode> entry : ((SnapshotNode.Tree) node).entries().entrySet()) {
                        gen.writeFieldName(entry.getKey());
                        serialize(entry.getValue(), gen, provider);
                    }
                    gen.writeEndObject();
                }
                case SEQUENCE -> {
                    gen.writeStartArray();
                    for (SnapshotNode item : ((SnapshotNode.Sequence) node).items()) {
                        serialize(item, gen, provider);
                    }
                    gen.writeEndArray();
                }
            }
        }
    }

    static final class SnapshotNodeDeserializer extends StdDeserializer<SnapshotNode> {
        SnapshotNodeDeserializer() {
            super(SnapshotNode.class);
        }

        @Override
        public SnapshotNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = p.readValueAsTree();
            return TreeSnapshotLoader.fromJson(tree);
        }

        @Override
        public SnapshotNode getNullValue(DeserializationContext ctxt) {
            return SnapshotNode.nullValue();
        }
    }

    static final class ChangeEntrySerializer extends StdSerializer<ChangeEntry> {
        private final SnapshotNodeSerializer nodeSerializer = new SnapshotNodeSerializer();

        ChangeEntrySerializer() {
            super(ChangeEntry.class);
        }

        @Override
        public void serialize(ChangeEntry entry, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            if (entry instanceof ChangeEntry.Failure failure) {
                gen.writeString(failure.message());
                return;
            }
            ChangeEntry.Modified modified = (ChangeEntry.Modified) entry;
            gen.writeStartObject();
            gen.writeFieldName("from");
            nodeSerializer.serialize(modified.from(), gen, provider);
            gen.writeFieldName("to");
            nodeSerializer.serialize(modified.to(), gen, provider);
            gen.writeEndObject();
        }
    }

    static final class ChangeEntryDeserializer extends StdDeserializer<ChangeEntry> {
        ChangeEntryDeserializer() {
            super(ChangeEntry.class);
        }

        @Override
        public ChangeEntry deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_STRING) {
                return new ChangeEntry.Failure(p.getText());
            }
            JsonNode tree = p.readValueAsTree();
            if (!tree.isObject()) {
                return ctxt.reportInputMismatch(
                        ChangeEntry.class, "Expected a change object or an error string");
            }
            return new ChangeEntry.Modified(
                    TreeSnapshotLoader.fromJson(tree.get("from")),
                    TreeSnapshotLoader.fromJson(tree.get("to")));
        }
    }
}
