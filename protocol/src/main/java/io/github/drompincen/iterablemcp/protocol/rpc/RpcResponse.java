package io.github.drompincen.iterablemcp.protocol.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RpcResponse(
        String jsonrpc,
        JsonNode id,
        JsonNode result,
        RpcError error
) {
    public static final String VERSION = "2.0";

    public static RpcResponse success(JsonNode id, JsonNode result) {
        return new RpcResponse(VERSION, id, result, null);
    }

    public static RpcResponse failure(JsonNode id, RpcError error) {
        return new RpcResponse(VERSION, id, null, error);
    }
}
