package io.github.drompincen.iterablemcp.runtime.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import io.github.drompincen.iterablemcp.protocol.api.PermissionConfig;

public record ToolContext(
        Credential credential,
        PermissionConfig permissions
) {}
