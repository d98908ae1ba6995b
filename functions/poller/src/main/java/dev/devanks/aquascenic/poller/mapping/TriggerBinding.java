package dev.devanks.aquascenic.poller.mapping;

import lombok.Value;

/**
 * Events fired when a boolean capability flips.
 */
@Value
public class TriggerBinding {
    String capabilityId;
    String risingEventId;
    String fallingEventId;

    public String eventFor(boolean newValue) {
        return newValue ? risingEventId : fallingEventId;
    }
}
