package io.github.drompincen.iterablemcp.protocol.api;

public enum ToolCapability {
    NON_PII,
    READ_ONLY,
    SEND
}
