// functions/poller/src/main/java/dev/devanks/aquascenic/poller/service/PoolClient.java
package dev.devanks.aquascenic.poller.service;

import dev.devanks.aquascenic.poller.client.FirestoreClient;
import dev.devanks.aquascenic.poller.codec.DocumentCodec;
import dev.devanks.aquascenic.poller.exception.PoolApiException;
import dev.devanks.aquascenic.poller.model.FirestoreDocument;
import dev.devanks.aquascenic.poller.model.TypedValue;
import dev.devanks.aquascenic.poller.session.Credentials;
import dev.devanks.aquascenic.poller.session.SessionManager;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Reads and writes one pool document on behalf of one account. Owns that account's session.
 */
@Slf4j
@RequiredArgsConstructor
public class PoolClient {

    private final FirestoreClient firestoreClient;
    private final SessionManager sessionManager;
    private final DocumentCodec codec;

    /**
     * Fetches the pool document and returns it decoded and flattened, e.g.
     * {@code modules_ph_current -> 740}.
     * <p>
     * A 401/403 drops the session and the read is retried once with a fresh token.
     *
     * @throws PoolApiException on any other failure, or when the retry fails as well
     */
    public Map<String, Object> fetch(String poolId) {
        String token = sessionManager.ensureValid();
        FirestoreDocument document;
        try {
            document = firestoreClient.getPool(bearer(token), poolId);
        } catch (FeignException e) {
            if (!isAuthorizationFailure(e)) {
                throw apiError("Failed to fetch pool data", e);
            }
            log.info("Document store rejected the token (HTTP {}), re-authenticating once", e.status());
            sessionManager.invalidate();
            String freshToken = sessionManager.ensureValid();
            try {
                document = firestoreClient.getPool(bearer(freshToken), poolId);
            } catch (FeignException retryFailure) {
                throw apiError("Failed to fetch pool data after re-authentication", retryFailure);
            }
        }

        if (document == null) {
            throw new PoolApiException("Failed to fetch pool data: empty response");
        }
        Map<String, Object> flat = codec.flatten(codec.decodeDocument(document.getFields()));
        log.debug("Fetched pool {} ({} flat keys, updated {})", poolId, flat.size(), document.getUpdateTime());
        return flat;
    }

    /**
     * Sets one leaf of the pool document. The update mask names exactly {@code dotPath}, so
     * sibling fields stay untouched.
     *
     * @param dotPath nested document path, e.g. {@code filtration.mode}
     */
    public void write(String poolId, String dotPath, Object value) {
        String token = sessionManager.ensureValid();
        Map<String, TypedValue> fields = codec.buildNestedFields(dotPath, value);
        log.info("Writing {} = {} to pool {}", dotPath, value, poolId);
        try {
            firestoreClient.patchPool(bearer(token), poolId, dotPath,
                    FirestoreDocument.builder().fields(fields).build());
        } catch (FeignException e) {
            if (isAuthorizationFailure(e)) {
                sessionManager.invalidate();
            }
            throw apiError("Failed to write " + dotPath, e);
        }
    }

    /**
     * Pairing probe. Never throws.
     */
    public boolean testCredentials() {
        try {
            sessionManager.authenticate();
            return true;
        } catch (RuntimeException e) {
            log.info("Credential check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Pairing probe. Never throws.
     */
    public boolean testConnection(String poolId) {
        try {
            fetch(poolId);
            return true;
        } catch (RuntimeException e) {
            log.info("Connection check for pool {} failed: {}", poolId, e.getMessage());
            return false;
        }
    }

    public void updateCredentials(Credentials credentials) {
        sessionManager.updateCredentials(credentials);
    }

    private static boolean isAuthorizationFailure(FeignException e) {
        return e.status() == 401 || e.status() == 403;
    }

    private static PoolApiException apiError(String action, FeignException e) {
        Integer status = e.status() > 0 ? e.status() : null;
        String reason = status != null ? "HTTP " + status : e.getMessage();
        return new PoolApiException(action + ": " + reason, status, e);
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }
}
