// functions/poller/src/main/java/dev/devanks/aquascenic/poller/device/PoolDeviceController.java
package dev.devanks.aquascenic.poller.device;

import dev.devanks.aquascenic.poller.exception.PoolApiException;
import dev.devanks.aquascenic.poller.exception.PoolAuthException;
import dev.devanks.aquascenic.poller.mapping.CapabilityMappings;
import dev.devanks.aquascenic.poller.mapping.FieldMapping;
import dev.devanks.aquascenic.poller.mapping.SettableFieldMapping;
import dev.devanks.aquascenic.poller.mapping.TriggerBinding;
import dev.devanks.aquascenic.poller.service.PoolClient;
import dev.devanks.aquascenic.poller.service.PoolClientFactory;
import dev.devanks.aquascenic.poller.session.Credentials;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one managed pool: polls its document on a timer, maps fields onto capabilities,
 * fires edge events, and writes capability changes back to the pool.
 * <p>
 * States: UNINITIALIZED until the first good poll, then POLLING. An authentication failure
 * moves to NEEDS_CREDENTIALS, which only {@link #onCredentialsUpdated} leaves. API failures
 * keep POLLING and mark the device degraded until the next good poll.
 */
@Slf4j
public class PoolDeviceController {

    public enum State {
        UNINITIALIZED, POLLING, NEEDS_CREDENTIALS
    }

    public static final String POLL_INTERVAL_SETTING = "poll_interval";

    static final String NO_CREDENTIALS_MESSAGE = "No credentials configured. Please repair the device.";
    static final String NO_POOL_MESSAGE = "No pool configured. Please pair the device again.";
    static final String AUTH_FAILED_MESSAGE = "Authentication failed. Please repair the device to update credentials.";
    static final String OFFLINE_WARNING = "Pool controller is offline";
    static final String COMMUNICATION_WARNING = "Communication error with cloud service";

    private final DeviceHost host;
    private final PoolClientFactory poolClientFactory;
    @Getter
    private final String poolId;
    private final Duration defaultPollInterval;
    private final Duration reconcileDelay;

    private final AtomicBoolean pollInFlight = new AtomicBoolean(false);
    private final Set<String> registeredListeners = ConcurrentHashMap.newKeySet();

    private volatile PoolClient client;
    private volatile ScheduledFuture<?> pollTimer;
    @Getter
    private volatile State state = State.UNINITIALIZED;
    @Getter
    private volatile boolean degraded;

    public PoolDeviceController(DeviceHost host, PoolClientFactory poolClientFactory, String poolId,
                                Credentials credentials, Duration defaultPollInterval, Duration reconcileDelay) {
        this.host = Objects.requireNonNull(host, "host");
        this.poolClientFactory = Objects.requireNonNull(poolClientFactory, "poolClientFactory");
        this.poolId = Objects.requireNonNull(poolId, "poolId");
        this.defaultPollInterval = Objects.requireNonNull(defaultPollInterval, "defaultPollInterval");
        this.reconcileDelay = Objects.requireNonNull(reconcileDelay, "reconcileDelay");
        this.client = credentials == null ? null : poolClientFactory.create(credentials);
    }

    public void start() {
        log.info("Starting pool device {}", poolId);
        CapabilityMappings.requiredCapabilities().forEach(host::ensureCapability);

        if (poolId.isBlank()) {
            log.warn("No pool id configured, not polling");
            quietly("mark device unavailable", () -> host.setUnavailable(NO_POOL_MESSAGE));
            return;
        }
        if (client == null) {
            log.warn("Pool {} has no credentials, not polling", poolId);
            quietly("mark device unavailable", () -> host.setUnavailable(NO_CREDENTIALS_MESSAGE));
            return;
        }
        pollData();
        startPolling();
    }

    public void stop() {
        ScheduledFuture<?> timer = pollTimer;
        if (timer != null) {
            timer.cancel(false);
            pollTimer = null;
            log.info("Stopped polling pool {}", poolId);
        }
    }

    /**
     * Restarts the poll timer when the poll interval setting changed.
     */
    public void onSettingsChanged(Collection<String> changedKeys) {
        if (changedKeys.contains(POLL_INTERVAL_SETTING)) {
            log.info("Poll interval changed to {}", pollInterval());
            startPolling();
        }
    }

    public void onCredentialsUpdated(Credentials credentials) {
        log.info("Credentials updated, re-initializing pool client for {}", poolId);
        PoolClient current = client;
        if (current != null) {
            current.updateCredentials(credentials);
        } else {
            client = poolClientFactory.create(credentials);
        }
        state = State.UNINITIALIZED;

        boolean polled = pollData();
        if (pollTimer == null) {
            startPolling();
        }
        if (polled && state == State.POLLING) {
            quietly("mark device available", host::setAvailable);
        }
    }

    /**
     * One poll cycle. Skipped while a previous cycle is still waiting on the network, and
     * while the device waits for new credentials.
     *
     * @return whether this call ran a cycle, successful or not
     */
    public boolean pollData() {
        PoolClient current = client;
        if (current == null) {
            return false;
        }
        if (state == State.NEEDS_CREDENTIALS) {
            log.debug("Pool {} needs new credentials, skipping poll", poolId);
            return false;
        }
        if (!pollInFlight.compareAndSet(false, true)) {
            log.debug("Previous poll of {} still in flight, skipping", poolId);
            return false;
        }

        try {
            Map<String, Object> data = current.fetch(poolId);
            if (state != State.POLLING) {
                log.info("Pool {} is now polling", poolId);
            }
            state = State.POLLING;
            degraded = false;
            applyPoolState(data);
        } catch (PoolAuthException e) {
            log.error("Authentication error for pool {}: {}", poolId, e.getMessage());
            state = State.NEEDS_CREDENTIALS;
            quietly("mark device unavailable", () -> host.setUnavailable(AUTH_FAILED_MESSAGE));
        } catch (PoolApiException e) {
            log.error("API error for pool {}: {}", poolId, e.getMessage());
            degraded = true;
            quietly("set warning", () -> host.setWarning("Cloud error: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error while polling pool {}", poolId, e);
            degraded = true;
            quietly("set warning", () -> host.setWarning(COMMUNICATION_WARNING));
        } finally {
            pollInFlight.set(false);
        }
        return true;
    }

    private void applyPoolState(Map<String, Object> data) {
        log.debug("Poll data keys: {}", String.join(", ", data.keySet()));

        if (Boolean.FALSE.equals(data.get("present"))) {
            quietly("set warning", () -> host.setWarning(OFFLINE_WARNING));
        } else {
            quietly("clear warning", host::unsetWarning);
        }

        for (FieldMapping mapping : CapabilityMappings.READ_ONLY) {
            applyField(mapping, data);
        }
        for (SettableFieldMapping mapping : CapabilityMappings.SETTABLE) {
            applyField(mapping, data);
        }

        updateInfoSettings(data);

        if (!host.isAvailable()) {
            quietly("mark device available", host::setAvailable);
        }
    }

    /**
     * Absent keys are skipped, never cleared: this cycle's document just did not report them.
     */
    private void applyField(FieldMapping mapping, Map<String, Object> data) {
        Object raw = data.get(mapping.getFlatKey());
        log.debug("  {}: raw={}", mapping.getCapabilityId(), raw);
        if (raw == null) {
            return;
        }

        String capabilityId = mapping.getCapabilityId();
        try {
            host.ensureCapability(capabilityId);
            if (mapping instanceof SettableFieldMapping) {
                registerWriteListener((SettableFieldMapping) mapping);
            }
            Object value = mapping.toCapabilityValue(raw);
            fireEdgeEvent(capabilityId, value);
            host.setCapabilityValue(capabilityId, value);
        } catch (RuntimeException e) {
            log.error("Error processing {}", mapping.getFlatKey(), e);
        }
    }

    /**
     * Runs before the new value is committed, so the host still holds the previous one.
     * Nothing fires when there is no previous value.
     */
    private void fireEdgeEvent(String capabilityId, Object newValue) {
        Optional<TriggerBinding> binding = CapabilityMappings.triggerFor(capabilityId);
        if (binding.isEmpty() || !(newValue instanceof Boolean)) {
            return;
        }
        Object previous = host.getCapabilityValue(capabilityId);
        if (!(previous instanceof Boolean) || previous.equals(newValue)) {
            return;
        }
        String eventId = binding.get().eventFor((Boolean) newValue);
        log.info("{} changed {} -> {}, firing {}", capabilityId, previous, newValue, eventId);
        quietly("fire " + eventId, () -> host.triggerEvent(eventId));
    }

    private void registerWriteListener(SettableFieldMapping mapping) {
        if (registeredListeners.add(mapping.getCapabilityId())) {
            log.info("Registering write listener for {}", mapping.getCapabilityId());
            host.registerCapabilityListener(mapping.getCapabilityId(), value -> writeCapability(mapping, value));
        }
    }

    /**
     * Writes through to the pool, then schedules a one-shot re-poll to pick up the state the
     * controller settles on. Failures propagate to the host.
     */
    private void writeCapability(SettableFieldMapping mapping, Object value) {
        PoolClient current = client;
        if (current == null) {
            throw new PoolAuthException(NO_CREDENTIALS_MESSAGE);
        }
        Object remoteValue = mapping.toRemoteValue(value);
        log.info("Setting {} to {} ({} = {})", mapping.getCapabilityId(), value, mapping.getWritePath(), remoteValue);
        current.write(poolId, mapping.getWritePath(), remoteValue);
        host.scheduleOnce(reconcileDelay, this::pollData);
    }

    private void updateInfoSettings(Map<String, Object> data) {
        Map<String, Object> updates = new LinkedHashMap<>();
        if (data.containsKey("main_version")) {
            updates.put("firmware_version", String.valueOf(data.get("main_version")));
        }
        if (data.containsKey("main_wifiVersion")) {
            updates.put("wifi_version", String.valueOf(data.get("main_wifiVersion")));
        }
        updates.put("pool_id", poolId);
        quietly("update device settings", () -> host.setSettings(updates));
    }

    private void startPolling() {
        stop();
        Duration interval = pollInterval();
        log.info("Starting polling of {} every {} minutes", poolId, interval.toMinutes());
        pollTimer = host.scheduleRecurring(interval, this::pollData);
    }

    private Duration pollInterval() {
        return host.getSetting(POLL_INTERVAL_SETTING)
                .filter(Number.class::isInstance)
                .map(Number.class::cast)
                .filter(minutes -> minutes.longValue() > 0)
                .map(minutes -> Duration.ofMinutes(minutes.longValue()))
                .orElse(defaultPollInterval);
    }

    private void quietly(String action, Runnable hostCall) {
        try {
            hostCall.run();
        } catch (RuntimeException e) {
            log.error("Failed to {}", action, e);
        }
    }
}
