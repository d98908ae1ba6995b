// functions/poller/src/main/java/dev/devanks/aquascenic/poller/client/FirestoreClient.java
package dev.devanks.aquascenic.poller.client;

import dev.devanks.aquascenic.poller.config.FeignClientConfig;
import dev.devanks.aquascenic.poller.model.FirestoreDocument;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;

import static org.springframework.http.HttpHeaders.AUTHORIZATION;

/**
 * Document store REST API, scoped to the {@code pools} collection.
 * Every call carries {@code Authorization: Bearer <idToken>}.
 */
@FeignClient(name = "pool-firestore",
        url = "${aquascenic.firestore.url}",
        configuration = FeignClientConfig.class)
public interface FirestoreClient {

    @GetMapping("/pools/{poolId}")
    FirestoreDocument getPool(@RequestHeader(AUTHORIZATION) String authorization,
                              @PathVariable("poolId") String poolId);

    /**
     * Partial update: only the field named by {@code fieldPath} is touched, sibling fields
     * are left as they are.
     */
    @PatchMapping("/pools/{poolId}")
    FirestoreDocument patchPool(@RequestHeader(AUTHORIZATION) String authorization,
                                @PathVariable("poolId") String poolId,
                                @RequestParam("updateMask.fieldPaths") String fieldPath,
                                @RequestBody FirestoreDocument patch);

}
