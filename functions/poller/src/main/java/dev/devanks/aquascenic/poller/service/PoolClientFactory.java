// functions/poller/src/main/java/dev/devanks/aquascenic/poller/service/PoolClientFactory.java
package dev.devanks.aquascenic.poller.service;

import dev.devanks.aquascenic.poller.client.FirestoreClient;
import dev.devanks.aquascenic.poller.client.IdentityToolkitClient;
import dev.devanks.aquascenic.poller.client.SecureTokenClient;
import dev.devanks.aquascenic.poller.codec.DocumentCodec;
import dev.devanks.aquascenic.poller.config.PoolProperties;
import dev.devanks.aquascenic.poller.session.Credentials;
import dev.devanks.aquascenic.poller.session.SessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates a {@link PoolClient} with its own session for the given account.
 */
@Component
@RequiredArgsConstructor
public class PoolClientFactory {

    private final FirestoreClient firestoreClient;
    private final IdentityToolkitClient identityToolkitClient;
    private final SecureTokenClient secureTokenClient;
    private final DocumentCodec documentCodec;
    private final PoolProperties properties;
    private final Clock clock;

    public PoolClient create(Credentials credentials) {
        SessionManager sessionManager = new SessionManager(
                identityToolkitClient,
                secureTokenClient,
                properties.getIdentity().getApiKey(),
                credentials,
                clock);
        return new PoolClient(firestoreClient, sessionManager, documentCodec);
    }
}
