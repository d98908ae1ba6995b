// functions/poller/src/main/java/dev/devanks/aquascenic/poller/model/SignInResponse.java
package dev.devanks.aquascenic.poller.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignInResponse {

    @ToString.Exclude
    @JsonProperty("idToken")
    private String idToken;

    @ToString.Exclude
    @JsonProperty("refreshToken")
    private String refreshToken;

    @JsonProperty("expiresIn")
    private String expiresIn; // Seconds, string-encoded

    @JsonProperty("localId")
    private String localId;

    @JsonProperty("email")
    private String email;

    @JsonProperty("registered")
    private Boolean registered;
}
