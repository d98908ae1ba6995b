// functions/poller/src/main/java/dev/devanks/aquascenic/poller/config/PoolProperties.java
package dev.devanks.aquascenic.poller.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "aquascenic")
public class PoolProperties {

    public static final int DEFAULT_POLL_INTERVAL_MINUTES = 5;

    // Account used to sign in. Left blank until the device is paired.
    @Data
    public static class AccountProperties {
        private String email;
        @ToString.Exclude
        private String password;

        public boolean isComplete() {
            return email != null && !email.isBlank() && password != null && !password.isBlank();
        }
    }

    @Data
    @Validated
    public static class PoolSettings {
        private String id;

        @Positive
        private int pollIntervalMinutes = DEFAULT_POLL_INTERVAL_MINUTES;

        /**
         * Delay before the reconciliation poll that follows a write.
         */
        @NotNull
        private Duration reconcileDelay = Duration.ofSeconds(3);
    }

    @Data
    @Validated
    public static class IdentityProperties {
        @NotEmpty
        @ToString.Exclude
        private String apiKey;
        @NotEmpty
        @URL
        private String signInUrl;
        @NotEmpty
        @URL
        private String tokenUrl;
    }

    @Data
    @Validated
    public static class FirestoreProperties {
        @NotEmpty
        private String url; // Contains "(default)", which @URL rejects
    }

    @NotNull
    private AccountProperties account = new AccountProperties();

    @Valid
    @NotNull
    private PoolSettings pool = new PoolSettings();

    @Valid
    @NotNull
    private IdentityProperties identity = new IdentityProperties();

    @Valid
    @NotNull
    private FirestoreProperties firestore = new FirestoreProperties();
}
