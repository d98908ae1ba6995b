package dev.devanks.aquascenic.poller.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One typed value of the remote document store, e.g. {@code {"integerValue": "740"}}.
 * <p>
 * Exactly one variant tag is carried per value. Tags this class does not know are kept as
 * {@link Kind#UNRECOGNIZED} together with the raw payload so the codec can report them.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonSerialize(using = TypedValueJson.Serializer.class)
@JsonDeserialize(using = TypedValueJson.Deserializer.class)
public class TypedValue {

    public enum Kind {
        STRING("stringValue"),
        INTEGER("integerValue"),
        DOUBLE("doubleValue"),
        BOOLEAN("booleanValue"),
        NULL("nullValue"),
        TIMESTAMP("timestampValue"),
        ARRAY("arrayValue"),
        MAP("mapValue"),
        UNRECOGNIZED(null);

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }

        public static Optional<Kind> fromTag(String tag) {
            return Arrays.stream(values())
                    .filter(kind -> kind.tag != null && kind.tag.equals(tag))
                    .findFirst();
        }
    }

    Kind kind;

    /**
     * Wire tag as received. Same as {@code kind.getTag()} except for unrecognized values.
     */
    String tag;

    /**
     * String for string, integer and timestamp values (integers travel as decimal strings),
     * Double, Boolean, {@code null}, {@code List<TypedValue>}, {@code Map<String, TypedValue>},
     * or the raw {@link JsonNode} of an unrecognized value.
     */
    Object value;

    public static TypedValue ofString(String value) {
        return new TypedValue(Kind.STRING, Kind.STRING.getTag(), value);
    }

    public static TypedValue ofInteger(String value) {
        return new TypedValue(Kind.INTEGER, Kind.INTEGER.getTag(), value);
    }

    public static TypedValue ofInteger(long value) {
        return ofInteger(Long.toString(value));
    }

    public static TypedValue ofDouble(double value) {
        return new TypedValue(Kind.DOUBLE, Kind.DOUBLE.getTag(), value);
    }

    public static TypedValue ofBoolean(boolean value) {
        return new TypedValue(Kind.BOOLEAN, Kind.BOOLEAN.getTag(), value);
    }

    public static TypedValue ofNull() {
        return new TypedValue(Kind.NULL, Kind.NULL.getTag(), null);
    }

    public static TypedValue ofTimestamp(String value) {
        return new TypedValue(Kind.TIMESTAMP, Kind.TIMESTAMP.getTag(), value);
    }

    public static TypedValue ofArray(List<TypedValue> values) {
        return new TypedValue(Kind.ARRAY, Kind.ARRAY.getTag(), Collections.unmodifiableList(values));
    }

    public static TypedValue ofMap(Map<String, TypedValue> fields) {
        return new TypedValue(Kind.MAP, Kind.MAP.getTag(), Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static TypedValue unrecognized(String tag, JsonNode raw) {
        return new TypedValue(Kind.UNRECOGNIZED, tag, raw);
    }

    public String asText() {
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<TypedValue> asList() {
        return (List<TypedValue>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, TypedValue> asMap() {
        return (Map<String, TypedValue>) value;
    }
}
