package dev.devanks.aquascenic.poller.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.aquascenic.poller.client.IdentityToolkitClient;
import dev.devanks.aquascenic.poller.client.SecureTokenClient;
import dev.devanks.aquascenic.poller.exception.PoolAuthException;
import dev.devanks.aquascenic.poller.model.SignInRequest;
import dev.devanks.aquascenic.poller.model.SignInResponse;
import dev.devanks.aquascenic.poller.model.TokenRefreshResponse;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the credentials and the current token pair for one account.
 * <p>
 * All session mutations happen under one lock, so a poll and a capability write running
 * at the same time never see a half-replaced session or sign in twice.
 */
@Slf4j
public class SessionManager {

    /**
     * Tokens expiring within this window are refreshed before use.
     */
    public static final Duration REFRESH_BUFFER = Duration.ofMinutes(5);

    private static final long DEFAULT_LIFETIME_SECONDS = 3600;
    private static final ObjectMapper ERROR_READER = new ObjectMapper();

    private final IdentityToolkitClient identityClient;
    private final SecureTokenClient tokenClient;
    private final String apiKey;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Credentials credentials;
    private volatile Session session;

    public SessionManager(IdentityToolkitClient identityClient, SecureTokenClient tokenClient, String apiKey,
                          Credentials credentials, Clock clock) {
        this.identityClient = Objects.requireNonNull(identityClient, "identityClient");
        this.tokenClient = Objects.requireNonNull(tokenClient, "tokenClient");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Signs in with the stored email and secret and replaces the session.
     *
     * @throws PoolAuthException when the provider rejects the credentials or cannot be reached
     */
    public Session authenticate() {
        lock.lock();
        try {
            return signIn();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Exchanges the refresh token for a new session. A rejected refresh token clears the
     * session, so the next {@link #ensureValid()} signs in from scratch.
     *
     * @throws PoolAuthException when no refresh token is held or the provider rejects it
     */
    public Session refresh() {
        lock.lock();
        try {
            return exchangeRefreshToken();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an id token valid for at least {@link #REFRESH_BUFFER}, signing in or refreshing
     * as needed. A failed refresh falls back to a full sign-in once.
     */
    public String ensureValid() {
        lock.lock();
        try {
            Session current = session;
            if (current == null) {
                return signIn().getIdToken();
            }
            if (current.isExpiringWithin(REFRESH_BUFFER, clock.instant())) {
                try {
                    return exchangeRefreshToken().getIdToken();
                } catch (RuntimeException e) {
                    log.warn("Token refresh failed, attempting full re-authentication: {}", e.getMessage());
                    return signIn().getIdToken();
                }
            }
            return current.getIdToken();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the session. Used after the data API rejected a token the provider still
     * considered valid.
     */
    public void invalidate() {
        lock.lock();
        try {
            session = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the credentials and drops the session. Does not sign in.
     */
    public void updateCredentials(Credentials newCredentials) {
        Objects.requireNonNull(newCredentials, "newCredentials");
        lock.lock();
        try {
            credentials = newCredentials;
            session = null;
        } finally {
            lock.unlock();
        }
        log.info("Credentials updated for {}, session cleared", newCredentials.getEmail());
    }

    public Optional<Session> currentSession() {
        return Optional.ofNullable(session);
    }

    private Session signIn() {
        Credentials current = credentials;
        log.info("Authenticating {} with identity provider...", current.getEmail());
        SignInResponse response;
        try {
            response = identityClient.signInWithPassword(apiKey, SignInRequest.builder()
                    .email(current.getEmail())
                    .password(current.getSecret())
                    .returnSecureToken(true)
                    .build());
        } catch (FeignException e) {
            session = null;
            throw new PoolAuthException("Authentication failed: " + providerMessage(e), statusOf(e), e);
        }
        if (response == null || isBlank(response.getIdToken())) {
            session = null;
            throw new PoolAuthException("Authentication failed: response carried no id token");
        }

        session = new Session(
                response.getIdToken(),
                response.getRefreshToken(),
                expiryFrom(response.getExpiresIn()),
                response.getLocalId());
        log.info("Authentication successful, token valid until {}", session.getExpiresAt());
        return session;
    }

    private Session exchangeRefreshToken() {
        Session current = session;
        if (current == null || isBlank(current.getRefreshToken())) {
            throw new PoolAuthException("No refresh token available, must re-authenticate");
        }

        log.info("Refreshing id token...");
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", current.getRefreshToken());

        TokenRefreshResponse response;
        try {
            response = tokenClient.refresh(apiKey, form);
        } catch (FeignException e) {
            session = null;
            throw new PoolAuthException("Token refresh failed: HTTP " + e.status(), statusOf(e), e);
        }
        if (response == null || isBlank(response.getIdToken())) {
            session = null;
            throw new PoolAuthException("Token refresh failed: response carried no id token");
        }

        session = new Session(
                response.getIdToken(),
                isBlank(response.getRefreshToken()) ? current.getRefreshToken() : response.getRefreshToken(),
                expiryFrom(response.getExpiresIn()),
                response.getUserId());
        log.info("Token refreshed successfully, valid until {}", session.getExpiresAt());
        return session;
    }

    private Instant expiryFrom(String expiresIn) {
        long seconds;
        try {
            seconds = Long.parseLong(isBlank(expiresIn) ? "" : expiresIn.trim());
        } catch (NumberFormatException e) {
            log.warn("Provider declared no usable token lifetime ('{}'), assuming {}s", expiresIn, DEFAULT_LIFETIME_SECONDS);
            seconds = DEFAULT_LIFETIME_SECONDS;
        }
        return clock.instant().plusSeconds(seconds);
    }

    /**
     * Reads {@code error.message} from a provider error body, e.g. {@code INVALID_PASSWORD}.
     */
    @VisibleForTesting
    static String providerMessage(FeignException e) {
        String body = e.contentUTF8();
        if (!isBlank(body)) {
            try {
                JsonNode message = ERROR_READER.readTree(body).path("error").path("message");
                if (message.isTextual()) {
                    return message.asText();
                }
            } catch (IOException ignored) {
                log.debug("Provider error body is not JSON: {}", body);
            }
        }
        return e.status() > 0 ? "HTTP " + e.status() : e.getMessage();
    }

    private static Integer statusOf(FeignException e) {
        return e.status() > 0 ? e.status() : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
