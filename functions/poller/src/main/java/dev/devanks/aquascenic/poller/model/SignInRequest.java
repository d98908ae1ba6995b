package dev.devanks.aquascenic.poller.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignInRequest {

    private String email;

    @ToString.Exclude
    private String password;

    @Builder.Default
    private boolean returnSecureToken = true;
}
