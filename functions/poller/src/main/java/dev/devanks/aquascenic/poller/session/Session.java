package dev.devanks.aquascenic.poller.session;

import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Token pair issued by the identity provider. Held in memory only.
 */
@Value
public class Session {

    @ToString.Exclude
    String idToken;

    @ToString.Exclude
    String refreshToken;

    Instant expiresAt;

    /**
     * Opaque account id ({@code localId} / {@code user_id}).
     */
    String subjectId;

    public boolean isExpiringWithin(Duration buffer, Instant now) {
        return !now.isBefore(expiresAt.minus(buffer));
    }
}
