package dev.devanks.aquascenic.poller.codec;

import dev.devanks.aquascenic.poller.exception.DocumentCodecException;
import dev.devanks.aquascenic.poller.model.TypedValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts between the document store's typed values and plain Java values, and between
 * nested and flat (separator-joined) key layouts.
 * <p>
 * Decoded values are {@link String}, {@link Long}, {@link Double}, {@link Boolean},
 * {@code null}, {@code List<Object>} or {@code Map<String, Object>}. Timestamps stay strings.
 */
@Component
@Slf4j
public class DocumentCodec {

    /**
     * Separator used for flat pool state keys, e.g. {@code modules_ph_current}.
     */
    public static final String FLAT_KEY_SEPARATOR = "_";

    /**
     * Separator of write paths, which address the nested document, e.g. {@code hidro.level}.
     */
    public static final String PATH_SEPARATOR = ".";

    public Object decodeValue(TypedValue value) {
        if (value == null) {
            return null;
        }
        switch (value.getKind()) {
            case STRING:
            case TIMESTAMP:
                return value.asText();
            case INTEGER:
                return parseInteger(value.asText());
            case DOUBLE:
            case BOOLEAN:
                return value.getValue();
            case NULL:
                return null;
            case ARRAY:
                List<Object> values = new ArrayList<>(value.asList().size());
                for (TypedValue element : value.asList()) {
                    values.add(decodeValue(element));
                }
                return values;
            case MAP:
                return decodeDocument(value.asMap());
            default:
                throw new DocumentCodecException("Unrecognized typed value tag '" + value.getTag() + "'");
        }
    }

    /**
     * Decodes every named field. A field that cannot be decoded is logged and left out, so one
     * unexpected value never costs the rest of the document.
     */
    public Map<String, Object> decodeDocument(Map<String, TypedValue> fields) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (fields == null) {
            return result;
        }
        fields.forEach((name, typedValue) -> {
            try {
                result.put(name, decodeValue(typedValue));
            } catch (DocumentCodecException e) {
                log.warn("Skipping field '{}': {}", name, e.getMessage());
            }
        });
        return result;
    }

    public Map<String, Object> flatten(Map<String, ?> nested) {
        return flatten(nested, "", FLAT_KEY_SEPARATOR);
    }

    /**
     * Nested maps are walked, everything else (lists included) becomes a leaf under
     * {@code prefix + key}.
     */
    public Map<String, Object> flatten(Map<String, ?> nested, String prefix, String separator) {
        Map<String, Object> result = new LinkedHashMap<>();
        flattenInto(result, nested, prefix == null ? "" : prefix, separator);
        return result;
    }

    @SuppressWarnings("unchecked")
    private void flattenInto(Map<String, Object> target, Map<String, ?> nested, String prefix, String separator) {
        for (Map.Entry<String, ?> entry : nested.entrySet()) {
            String key = prefix + entry.getKey();
            if (entry.getValue() instanceof Map) {
                flattenInto(target, (Map<String, ?>) entry.getValue(), key + separator, separator);
            } else {
                target.put(key, entry.getValue());
            }
        }
    }

    public Map<String, Object> unflatten(Map<String, ?> flat) {
        return unflatten(flat, FLAT_KEY_SEPARATOR);
    }

    /**
     * Rebuilds the nested layout by splitting every key on {@code separator}. Names that
     * themselves contain the separator come back nested one level deeper than they were.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> unflatten(Map<String, ?> flat, String separator) {
        Map<String, Object> root = new LinkedHashMap<>();
        Pattern splitter = Pattern.compile(Pattern.quote(separator));
        for (Map.Entry<String, ?> entry : flat.entrySet()) {
            String[] segments = splitter.split(entry.getKey(), -1);
            Map<String, Object> node = root;
            for (int i = 0; i < segments.length - 1; i++) {
                Object child = node.computeIfAbsent(segments[i], k -> new LinkedHashMap<String, Object>());
                if (!(child instanceof Map)) {
                    throw new IllegalArgumentException("Key '" + entry.getKey() + "' conflicts with leaf '"
                            + String.join(separator, Arrays.copyOf(segments, i + 1)) + "'");
                }
                node = (Map<String, Object>) child;
            }
            node.put(segments[segments.length - 1], entry.getValue());
        }
        return root;
    }

    /**
     * Inverse of {@link #decodeValue}. Whole numbers, including whole doubles, become
     * integer values; anything not otherwise representable is written as its string form.
     */
    public TypedValue encodeValue(Object value) {
        if (value == null) {
            return TypedValue.ofNull();
        }
        if (value instanceof Boolean) {
            return TypedValue.ofBoolean((Boolean) value);
        }
        if (value instanceof Number) {
            return encodeNumber((Number) value);
        }
        if (value instanceof CharSequence) {
            return TypedValue.ofString(value.toString());
        }
        if (value instanceof Collection) {
            List<TypedValue> values = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                values.add(encodeValue(element));
            }
            return TypedValue.ofArray(values);
        }
        if (value instanceof Object[]) {
            return encodeValue(Arrays.asList((Object[]) value));
        }
        if (value instanceof Map) {
            Map<String, TypedValue> fields = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> fields.put(String.valueOf(k), encodeValue(v)));
            return TypedValue.ofMap(fields);
        }
        log.debug("Encoding {} as string", value.getClass().getName());
        return TypedValue.ofString(String.valueOf(value));
    }

    /**
     * Builds the minimal field tree that sets one leaf, e.g. {@code hidro.level = 50} becomes
     * {@code {hidro: {mapValue: {fields: {level: {integerValue: "50"}}}}}}.
     */
    public Map<String, TypedValue> buildNestedFields(String dotPath, Object value) {
        if (dotPath == null || dotPath.isBlank()) {
            throw new IllegalArgumentException("Field path must not be empty");
        }
        String[] segments = dotPath.split(Pattern.quote(PATH_SEPARATOR), -1);
        TypedValue current = encodeValue(value);
        for (int i = segments.length - 1; i > 0; i--) {
            requireSegment(dotPath, segments[i]);
            current = TypedValue.ofMap(Map.of(segments[i], current));
        }
        requireSegment(dotPath, segments[0]);
        Map<String, TypedValue> fields = new LinkedHashMap<>();
        fields.put(segments[0], current);
        return fields;
    }

    private static void requireSegment(String dotPath, String segment) {
        if (segment.isEmpty()) {
            throw new IllegalArgumentException("Field path '" + dotPath + "' has an empty segment");
        }
    }

    private static TypedValue encodeNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d)) {
                return TypedValue.ofInteger(new BigDecimal(d).toBigInteger().toString());
            }
            return TypedValue.ofDouble(d);
        }
        if (number instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) number;
            if (decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0) {
                return TypedValue.ofInteger(decimal.toBigInteger().toString());
            }
            return TypedValue.ofDouble(decimal.doubleValue());
        }
        if (number instanceof BigInteger) {
            return TypedValue.ofInteger(number.toString());
        }
        return TypedValue.ofInteger(number.longValue());
    }

    private static Long parseInteger(String text) {
        if (text == null) {
            throw new DocumentCodecException("Integer value without digits");
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new DocumentCodecException("Malformed integer value '" + text + "'", e);
        }
    }
}
