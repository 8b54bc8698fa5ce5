package io.github.drompincen.iterablemcp.protocol.api;

public enum CredentialSource {
    QUERY,
    HEADER,
    ENVIRONMENT
}
