package dev.devanks.aquascenic.poller.session;

import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class Credentials {
    @NonNull
    String email;
    @NonNull
    @ToString.Exclude
    String secret;
}
