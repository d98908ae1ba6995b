package dev.devanks.aquascenic.poller.mapping;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A mapping that can also be written back. {@code writePath} addresses the nested document
 * ({@code filtration.mode}), not the flat key.
 */
@Getter
@ToString(callSuper = true, onlyExplicitlyIncluded = true)
public class SettableFieldMapping extends FieldMapping {

    @ToString.Include
    private final String writePath;

    private final UnaryOperator<Object> reverseTransform;

    private SettableFieldMapping(String flatKey, String capabilityId, String writePath,
                                 UnaryOperator<Object> transform, UnaryOperator<Object> reverseTransform) {
        super(flatKey, capabilityId, transform, true);
        this.writePath = Objects.requireNonNull(writePath, "writePath");
        this.reverseTransform = reverseTransform;
    }

    public static SettableFieldMapping of(String flatKey, String capabilityId, String writePath) {
        return new SettableFieldMapping(flatKey, capabilityId, writePath, null, null);
    }

    public static SettableFieldMapping of(String flatKey, String capabilityId, String writePath,
                                          UnaryOperator<Object> transform, UnaryOperator<Object> reverseTransform) {
        return new SettableFieldMapping(flatKey, capabilityId, writePath, transform, reverseTransform);
    }

    public static SettableFieldMapping of(String flatKey, String capabilityId, String writePath, CodeTable codes) {
        return of(flatKey, capabilityId, writePath, Transforms.toLabel(codes), Transforms.toCode(codes));
    }

    public Object toRemoteValue(Object capabilityValue) {
        return reverseTransform == null ? capabilityValue : reverseTransform.apply(capabilityValue);
    }
}
