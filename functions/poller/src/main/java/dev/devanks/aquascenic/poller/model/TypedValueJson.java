package dev.devanks.aquascenic.poller.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson binding for {@link TypedValue}: a single-entry object whose key is the variant tag.
 */
public final class TypedValueJson {

    private TypedValueJson() {
    }

    public static class Deserializer extends StdDeserializer<TypedValue> {

        public Deserializer() {
            super(TypedValue.class);
        }

        @Override
        public TypedValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            JsonNode node = parser.getCodec().readTree(parser);
            return fromNode(node);
        }

        @Override
        public TypedValue getNullValue(DeserializationContext context) {
            return TypedValue.ofNull();
        }

        static TypedValue fromNode(JsonNode node) {
            if (node == null || node.isNull()) {
                return TypedValue.ofNull();
            }
            Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
            if (!entries.hasNext()) {
                return TypedValue.unrecognized("", node);
            }
            Map.Entry<String, JsonNode> entry = entries.next();
            String tag = entry.getKey();
            JsonNode payload = entry.getValue();

            switch (tag) {
                case "stringValue":
                    return TypedValue.ofString(payload.asText());
                case "integerValue":
                    return TypedValue.ofInteger(payload.asText());
                case "doubleValue":
                    return TypedValue.ofDouble(payload.asDouble());
                case "booleanValue":
                    return TypedValue.ofBoolean(payload.asBoolean());
                case "nullValue":
                    return TypedValue.ofNull();
                case "timestampValue":
                    return TypedValue.ofTimestamp(payload.asText());
                case "arrayValue":
                    List<TypedValue> values = new ArrayList<>();
                    for (JsonNode element : payload.path("values")) {
                        values.add(fromNode(element));
                    }
                    return TypedValue.ofArray(values);
                case "mapValue":
                    Map<String, TypedValue> fields = new LinkedHashMap<>();
                    payload.path("fields").fields()
                            .forEachRemaining(field -> fields.put(field.getKey(), fromNode(field.getValue())));
                    return TypedValue.ofMap(fields);
                default:
                    return TypedValue.unrecognized(tag, payload);
            }
        }
    }

    public static class Serializer extends StdSerializer<TypedValue> {

        public Serializer() {
            super(TypedValue.class);
        }

        @Override
        public void serialize(TypedValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeFieldName(value.getTag());
            switch (value.getKind()) {
                case STRING:
                case INTEGER:
                case TIMESTAMP:
                    gen.writeString(value.asText());
                    break;
                case DOUBLE:
                    gen.writeNumber((Double) value.getValue());
                    break;
                case BOOLEAN:
                    gen.writeBoolean((Boolean) value.getValue());
                    break;
                case NULL:
                    gen.writeNull();
                    break;
                case ARRAY:
                    gen.writeStartObject();
                    gen.writeArrayFieldStart("values");
                    for (TypedValue element : value.asList()) {
                        serialize(element, gen, provider);
                    }
                    gen.writeEndArray();
                    gen.writeEndObject();
                    break;
                case MAP:
                    gen.writeStartObject();
                    gen.writeObjectFieldStart("fields");
                    for (Map.Entry<String, TypedValue> field : value.asMap().entrySet()) {
                        gen.writeFieldName(field.getKey());
                        serialize(field.getValue(), gen, provider);
                    }
                    gen.writeEndObject();
                    gen.writeEndObject();
                    break;
                default:
                    gen.writeTree((JsonNode) value.getValue());
            }
            gen.writeEndObject();
        }
    }
}
