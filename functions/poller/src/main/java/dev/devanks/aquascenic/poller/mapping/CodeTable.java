package dev.devanks.aquascenic.poller.mapping;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Bidirectional lookup between a small integer code in the pool document and a named
 * setting on the device. Neither direction fails: unknown codes read as the default label,
 * unknown labels write as the default code.
 */
@Getter
@ToString
public final class CodeTable {

    private final String name;
    private final Map<Long, String> labels;
    private final String defaultLabel;
    private final long defaultCode;

    private CodeTable(String name, Map<Long, String> labels, String defaultLabel, long defaultCode) {
        this.name = name;
        this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
        this.defaultLabel = defaultLabel;
        this.defaultCode = defaultCode;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String label(Object code) {
        Long key = Transforms.asWholeNumber(code);
        if (key != null && labels.containsKey(key)) {
            return labels.get(key);
        }
        return defaultLabel;
    }

    public long code(Object label) {
        if (label != null) {
            String wanted = label.toString();
            for (Map.Entry<Long, String> entry : labels.entrySet()) {
                if (entry.getValue().equals(wanted)) {
                    return entry.getKey();
                }
            }
        }
        return defaultCode;
    }

    public static final class Builder {
        private final String name;
        private final Map<Long, String> labels = new TreeMap<>();
        private String defaultLabel;
        private Long defaultCode;

        private Builder(String name) {
            this.name = name;
        }

        public Builder code(long code, String label) {
            labels.put(code, Objects.requireNonNull(label, "label"));
            return this;
        }

        public Builder defaults(String label, long code) {
            this.defaultLabel = label;
            this.defaultCode = code;
            return this;
        }

        public CodeTable build() {
            if (defaultLabel == null || defaultCode == null) {
                throw new IllegalStateException("Code table '" + name + "' needs a default label and code");
            }
            return new CodeTable(name, labels, defaultLabel, defaultCode);
        }
    }
}
