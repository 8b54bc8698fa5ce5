package io.github.drompincen.iterablemcp.protocol.api;

import java.util.Objects;

/**
 * Upstream API key resolved for a single request.
 */
public record Credential(
        String secret,
        CredentialSource source
) {
    public Credential {
        Objects.requireNonNull(secret, "secret");
        Objects.requireNonNull(source, "source");
        if (secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be blank");
        }
    }

    @Override
    public String toString() {
        return "Credential[source=" + source + ", secret=***]";
    }
}
