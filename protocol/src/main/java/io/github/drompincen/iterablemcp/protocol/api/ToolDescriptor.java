package io.github.drompincen.iterablemcp.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

public record ToolDescriptor(
        String name,
        String description,
        JsonNode inputSchema,
        Set<ToolCapability> capabilities
) {}
