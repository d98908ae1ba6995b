package dev.devanks.aquascenic.poller.device;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Standalone host: keeps capabilities and settings in memory, runs timers on the Spring
 * task scheduler and logs events and availability changes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryDeviceHost implements DeviceHost {

    private final TaskScheduler taskScheduler;

    private final Map<String, Object> capabilityValues = new ConcurrentHashMap<>();
    private final Set<String> capabilities = ConcurrentHashMap.newKeySet();
    private final Map<String, CapabilityListener> listeners = new ConcurrentHashMap<>();
    private final Map<String, Object> settings = new ConcurrentHashMap<>();

    private volatile boolean available = true;
    private volatile String warning;

    @Override
    public Object getCapabilityValue(String capabilityId) {
        return capabilityValues.get(capabilityId);
    }

    @Override
    public void setCapabilityValue(String capabilityId, Object value) {
        if (!capabilities.contains(capabilityId)) {
            throw new IllegalStateException("Device has no capability '" + capabilityId + "'");
        }
        Object previous = value == null
                ? capabilityValues.remove(capabilityId)
                : capabilityValues.put(capabilityId, value);
        if (!Objects.equals(previous, value)) {
            log.info("{} = {}", capabilityId, value);
        }
    }

    @Override
    public boolean hasCapability(String capabilityId) {
        return capabilities.contains(capabilityId);
    }

    @Override
    public void addCapability(String capabilityId) {
        if (capabilities.add(capabilityId)) {
            log.info("Added capability {}", capabilityId);
        }
    }

    @Override
    public void registerCapabilityListener(String capabilityId, CapabilityListener listener) {
        listeners.put(capabilityId, listener);
    }

    /**
     * Requests a new value the way a user or automation would: the listener runs first and
     * the value is only stored once it succeeded.
     */
    public void requestCapabilityValue(String capabilityId, Object value) {
        CapabilityListener listener = listeners.get(capabilityId);
        if (listener == null) {
            throw new IllegalStateException("Capability '" + capabilityId + "' is not settable");
        }
        listener.onValue(value);
        setCapabilityValue(capabilityId, value);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public void setAvailable() {
        if (!available) {
            log.info("Device available");
        }
        available = true;
    }

    @Override
    public void setUnavailable(String message) {
        log.warn("Device unavailable: {}", message);
        available = false;
    }

    @Override
    public void setWarning(String message) {
        if (!message.equals(warning)) {
            log.warn("Device warning: {}", message);
        }
        warning = message;
    }

    @Override
    public void unsetWarning() {
        if (warning != null) {
            log.info("Device warning cleared");
        }
        warning = null;
    }

    public Optional<String> getWarning() {
        return Optional.ofNullable(warning);
    }

    @Override
    public Optional<Object> getSetting(String key) {
        return Optional.ofNullable(settings.get(key));
    }

    @Override
    public void setSettings(Map<String, ?> updates) {
        updates.forEach((key, value) -> {
            if (value == null) {
                settings.remove(key);
            } else {
                settings.put(key, value);
            }
        });
    }

    @Override
    public ScheduledFuture<?> scheduleOnce(Duration delay, Runnable task) {
        return taskScheduler.schedule(task, Instant.now().plus(delay));
    }

    @Override
    public ScheduledFuture<?> scheduleRecurring(Duration interval, Runnable task) {
        return taskScheduler.scheduleAtFixedRate(task, Instant.now().plus(interval), interval);
    }

    @Override
    public void triggerEvent(String eventId) {
        log.info("Trigger fired: {}", eventId);
    }
}
