package dev.devanks.aquascenic.poller.mapping;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Read-only link from a flat pool state key to a device capability.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class FieldMapping {

    @ToString.Include
    private final String flatKey;

    @ToString.Include
    private final String capabilityId;

    private final UnaryOperator<Object> transform;

    /**
     * Optional capabilities are added to the device the first time the pool reports them.
     */
    @ToString.Include
    private final boolean optional;

    protected FieldMapping(String flatKey, String capabilityId, UnaryOperator<Object> transform, boolean optional) {
        this.flatKey = Objects.requireNonNull(flatKey, "flatKey");
        this.capabilityId = Objects.requireNonNull(capabilityId, "capabilityId");
        this.transform = transform;
        this.optional = optional;
    }

    public static FieldMapping of(String flatKey, String capabilityId) {
        return new FieldMapping(flatKey, capabilityId, null, false);
    }

    public static FieldMapping of(String flatKey, String capabilityId, UnaryOperator<Object> transform) {
        return new FieldMapping(flatKey, capabilityId, transform, false);
    }

    public static FieldMapping optional(String flatKey, String capabilityId) {
        return new FieldMapping(flatKey, capabilityId, null, true);
    }

    public static FieldMapping optional(String flatKey, String capabilityId, UnaryOperator<Object> transform) {
        return new FieldMapping(flatKey, capabilityId, transform, true);
    }

    public Object toCapabilityValue(Object remoteValue) {
        return transform == null ? remoteValue : transform.apply(remoteValue);
    }
}
