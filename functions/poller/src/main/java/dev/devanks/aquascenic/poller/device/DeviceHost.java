package dev.devanks.aquascenic.poller.device;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * What the automation host provides to a managed pool device: capability storage, flags,
 * settings, timers and event dispatch.
 */
public interface DeviceHost {

    /**
     * Last committed value, or {@code null} when the capability was never set.
     */
    Object getCapabilityValue(String capabilityId);

    void setCapabilityValue(String capabilityId, Object value);

    boolean hasCapability(String capabilityId);

    void addCapability(String capabilityId);

    /**
     * Adds the capability unless the device already has it.
     */
    default void ensureCapability(String capabilityId) {
        if (!hasCapability(capabilityId)) {
            addCapability(capabilityId);
        }
    }

    void registerCapabilityListener(String capabilityId, CapabilityListener listener);

    boolean isAvailable();

    void setAvailable();

    void setUnavailable(String message);

    void setWarning(String message);

    void unsetWarning();

    Optional<Object> getSetting(String key);

    void setSettings(Map<String, ?> settings);

    ScheduledFuture<?> scheduleOnce(Duration delay, Runnable task);

    ScheduledFuture<?> scheduleRecurring(Duration interval, Runnable task);

    void triggerEvent(String eventId);
}
