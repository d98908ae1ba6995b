package dev.devanks.aquascenic.poller.device;

/**
 * Called by the host when a user or automation asks for a new capability value.
 * Throwing reports the action as failed.
 */
@FunctionalInterface
public interface CapabilityListener {
    void onValue(Object value);
}
