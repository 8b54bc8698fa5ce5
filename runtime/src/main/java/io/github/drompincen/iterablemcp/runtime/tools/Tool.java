package io.github.drompincen.iterablemcp.runtime.tools;

import io.github.drompincen.iterablemcp.protocol.api.ToolCapability;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    Set<ToolCapability> capabilities();

    ToolResult execute(ToolContext ctx, JsonNode input);
}
