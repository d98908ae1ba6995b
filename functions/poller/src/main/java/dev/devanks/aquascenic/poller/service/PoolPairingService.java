package dev.devanks.aquascenic.poller.service;

import dev.devanks.aquascenic.poller.device.PoolDeviceController;
import dev.devanks.aquascenic.poller.exception.PairingException;
import dev.devanks.aquascenic.poller.session.Credentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Validates accounts and pool ids while a device is added or repaired.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolPairingService {

    static final String DEVICE_NAME = "Aquascenic Pool";

    private final PoolClientFactory poolClientFactory;

    public Pairing startPairing() {
        return new Pairing();
    }

    /**
     * Checks the new credentials against the identity provider and the device's pool, then
     * hands them to the running controller.
     */
    public void repair(PoolDeviceController device, String email, String secret) {
        Credentials credentials = new Credentials(email, secret);
        PoolClient probe = poolClientFactory.create(credentials);

        if (!probe.testCredentials()) {
            throw new PairingException("Invalid email or password.");
        }
        if (!probe.testConnection(device.getPoolId())) {
            throw new PairingException("Authentication succeeded but could not access the pool. "
                    + "Please check your account has access to this pool.");
        }

        log.info("Repair validated for pool {}, updating device credentials", device.getPoolId());
        device.onCredentialsUpdated(credentials);
    }

    /**
     * One pairing attempt: log in, pick the pool, list the resulting device.
     */
    public class Pairing {

        private Credentials credentials;
        private PoolClient client;
        private String poolId;

        public void login(String email, String secret) {
            credentials = new Credentials(email, secret);
            client = poolClientFactory.create(credentials);
            if (!client.testCredentials()) {
                client = null;
                throw new PairingException("Invalid email or password. "
                        + "Please check your Hayward/Aquascenic account credentials.");
            }
        }

        public void selectPool(String code) {
            String candidate = code == null ? "" : code.trim();
            if (candidate.isEmpty()) {
                throw new PairingException("Please enter your Pool ID.");
            }
            if (client == null) {
                throw new PairingException("Not authenticated. Please go back and log in.");
            }
            if (!client.testConnection(candidate)) {
                throw new PairingException("Could not find a pool with this ID. "
                        + "Please check the Pool ID in your Hayward/Aquascenic app.");
            }
            poolId = candidate;
        }

        public List<PairedDevice> listDevices() {
            if (client == null || poolId == null) {
                throw new PairingException("Pairing is not complete yet.");
            }
            return List.of(PairedDevice.builder()
                    .name(DEVICE_NAME)
                    .poolId(poolId)
                    .email(credentials.getEmail())
                    .secret(credentials.getSecret())
                    .build());
        }
    }
}
