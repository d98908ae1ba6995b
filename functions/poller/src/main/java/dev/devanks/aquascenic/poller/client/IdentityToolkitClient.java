// functions/poller/src/main/java/dev/devanks/aquascenic/poller/client/IdentityToolkitClient.java
package dev.devanks.aquascenic.poller.client;

import dev.devanks.aquascenic.poller.config.FeignClientConfig;
import dev.devanks.aquascenic.poller.model.SignInRequest;
import dev.devanks.aquascenic.poller.model.SignInResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Password sign-in against the identity provider backing the pool cloud.
 */
@FeignClient(name = "identity-toolkit",
        url = "${aquascenic.identity.sign-in-url}",
        configuration = FeignClientConfig.class)
public interface IdentityToolkitClient {

    @PostMapping("/v1/accounts:signInWithPassword")
    SignInResponse signInWithPassword(@RequestParam("key") String apiKey, @RequestBody SignInRequest request);

}
