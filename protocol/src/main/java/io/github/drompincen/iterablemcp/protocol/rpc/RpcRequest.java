package io.github.drompincen.iterablemcp.protocol.rpc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A JSON-RPC 2.0 request or notification as sent by MCP clients.
 */
public record RpcRequest(
        String jsonrpc,
        JsonNode id,
        String method,
        JsonNode params
) {
    /** Notifications carry no id and never get a response. */
    @JsonIgnore
    public boolean isNotification() {
        return id == null || id.isNull() || id.isMissingNode();
    }
}
