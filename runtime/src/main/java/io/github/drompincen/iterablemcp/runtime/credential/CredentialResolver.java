package io.github.drompincen.iterablemcp.runtime.credential;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import io.github.drompincen.iterablemcp.protocol.api.CredentialSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Picks the upstream API key for one request: query parameter, then header,
 * then the deployment default. Holds no per-request state.
 */
@Component
public class CredentialResolver {

    public static final String QUERY_PARAM = "api_key";
    public static final String HEADER = "X-Iterable-Api-Key";

    private static final Set<String> PROTECTED_PATHS = Set.of("/mcp", "/sse", "/sse/message");

    private final String defaultApiKey;

    public CredentialResolver(@Value("${iterable.api-key:}") String defaultApiKey) {
        this.defaultApiKey = defaultApiKey;
    }

    public Optional<Credential> resolve(String queryValue, String headerValue) {
        if (hasText(queryValue)) {
            return Optional.of(new Credential(queryValue, CredentialSource.QUERY));
        }
        if (hasText(headerValue)) {
            return Optional.of(new Credential(headerValue, CredentialSource.HEADER));
        }
        if (hasText(defaultApiKey)) {
            return Optional.of(new Credential(defaultApiKey, CredentialSource.ENVIRONMENT));
        }
        return Optional.empty();
    }

    public boolean requiresCredential(String path) {
        return path != null && PROTECTED_PATHS.contains(path);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
