package dev.devanks.aquascenic.poller.service;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Device descriptor handed to the host once pairing completes.
 */
@Value
@Builder
public class PairedDevice {
    String name;
    String poolId;
    String email;
    @ToString.Exclude
    String secret;
}
