package io.github.drompincen.iterablemcp.gateway.controller;

import io.github.drompincen.iterablemcp.gateway.config.PermissionSettings;
import io.github.drompincen.iterablemcp.gateway.filter.ApiKeyFilter;
import io.github.drompincen.iterablemcp.protocol.api.Credential;
import io.github.drompincen.iterablemcp.protocol.rpc.RpcRequest;
import io.github.drompincen.iterablemcp.protocol.rpc.RpcResponse;
import io.github.drompincen.iterablemcp.runtime.mcp.McpDispatcher;
import io.github.drompincen.iterablemcp.runtime.tools.ToolContext;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Streamable HTTP entry point: one JSON-RPC message in, one JSON response out.
 */
@RestController
@RequestMapping("/mcp")
public class McpController {

    private final McpDispatcher dispatcher;
    private final PermissionSettings permissionSettings;

    public McpController(McpDispatcher dispatcher, PermissionSettings permissionSettings) {
        this.dispatcher = dispatcher;
        this.permissionSettings = permissionSettings;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RpcResponse> handle(
            @RequestBody RpcRequest request,
            @RequestAttribute(name = ApiKeyFilter.CREDENTIAL_ATTRIBUTE, required = false) Credential credential) {
        ToolContext ctx = new ToolContext(credential, permissionSettings.current());
        return dispatcher.dispatch(request, ctx)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.accepted().build());
    }
}
