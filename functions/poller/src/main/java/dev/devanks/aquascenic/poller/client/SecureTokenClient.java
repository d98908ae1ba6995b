// functions/poller/src/main/java/dev/devanks/aquascenic/poller/client/SecureTokenClient.java
package dev.devanks.aquascenic.poller.client;

import dev.devanks.aquascenic.poller.config.FeignClientConfig;
import dev.devanks.aquascenic.poller.model.TokenRefreshResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.Map;

import static org.springframework.http.MediaType.APPLICATION_FORM_URLENCODED_VALUE;

/**
 * Exchanges a refresh token for a new id token. The body is form-encoded
 * ({@code grant_type=refresh_token&refresh_token=...}).
 */
@FeignClient(name = "secure-token",
        url = "${aquascenic.identity.token-url}",
        configuration = FeignClientConfig.class)
public interface SecureTokenClient {

    @PostMapping(value = "/v1/token", consumes = APPLICATION_FORM_URLENCODED_VALUE)
    TokenRefreshResponse refresh(@RequestParam("key") String apiKey, @RequestBody Map<String, ?> form);

}
