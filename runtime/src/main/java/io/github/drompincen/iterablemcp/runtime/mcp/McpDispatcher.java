package io.github.drompincen.iterablemcp.runtime.mcp;

import io.github.drompincen.iterablemcp.protocol.api.ToolDescriptor;
import io.github.drompincen.iterablemcp.protocol.rpc.RpcError;
import io.github.drompincen.iterablemcp.protocol.rpc.RpcRequest;
import io.github.drompincen.iterablemcp.protocol.rpc.RpcResponse;
import io.github.drompincen.iterablemcp.protocol.rpc.ToolCallResult;
import io.github.drompincen.iterablemcp.runtime.client.IterableApiException;
import io.github.drompincen.iterablemcp.runtime.policy.PermissionEvaluator;
import io.github.drompincen.iterablemcp.runtime.tools.Tool;
import io.github.drompincen.iterablemcp.runtime.tools.ToolContext;
import io.github.drompincen.iterablemcp.runtime.tools.ToolRegistry;
import io.github.drompincen.iterablemcp.runtime.tools.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Routes MCP JSON-RPC methods to the tool registry. Transport-agnostic: both the
 * streamable HTTP and the event-stream endpoints hand requests here.
 */
@Component
public class McpDispatcher {

    private static final Logger log = LoggerFactory.getLogger(McpDispatcher.class);

    public static final String SERVER_NAME = "iterable-mcp";
    public static final String SERVER_VERSION = "1.0.0";
    static final String DEFAULT_PROTOCOL_VERSION = "2024-11-05";

    private final ToolRegistry toolRegistry;
    private final PermissionEvaluator permissionEvaluator;
    private final ObjectMapper mapper;

    public McpDispatcher(ToolRegistry toolRegistry, PermissionEvaluator permissionEvaluator, ObjectMapper mapper) {
        this.toolRegistry = toolRegistry;
        this.permissionEvaluator = permissionEvaluator;
        this.mapper = mapper;
    }

    /** Returns the response to send back, or empty for notifications. */
    public Optional<RpcResponse> dispatch(RpcRequest request, ToolContext ctx) {
        if (request.isNotification()) {
            log.debug("Notification received: {}", request.method());
            return Optional.empty();
        }
        if (!RpcResponse.VERSION.equals(request.jsonrpc()) || request.method() == null) {
            return Optional.of(RpcResponse.failure(request.id(),
                    RpcError.of(RpcError.INVALID_REQUEST, "Invalid JSON-RPC request")));
        }
        JsonNode params = request.params() != null ? request.params() : mapper.createObjectNode();
        RpcResponse response = switch (request.method()) {
            case "initialize" -> RpcResponse.success(request.id(), initialize(params));
            case "ping" -> RpcResponse.success(request.id(), mapper.createObjectNode());
            case "tools/list" -> RpcResponse.success(request.id(), listTools(ctx));
            case "tools/call" -> callTool(request.id(), params, ctx);
            default -> RpcResponse.failure(request.id(),
                    RpcError.of(RpcError.METHOD_NOT_FOUND, "Method not found: " + request.method()));
        };
        return Optional.of(response);
    }

    private JsonNode initialize(JsonNode params) {
        ObjectNode result = mapper.createObjectNode();
        result.put("protocolVersion", params.path("protocolVersion").asText(DEFAULT_PROTOCOL_VERSION));
        result.putObject("capabilities").putObject("tools").put("listChanged", false);
        ObjectNode serverInfo = result.putObject("serverInfo");
        serverInfo.put("name", SERVER_NAME);
        serverInfo.put("version", SERVER_VERSION);
        return result;
    }

    private JsonNode listTools(ToolContext ctx) {
        ObjectNode result = mapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        for (ToolDescriptor descriptor : toolRegistry.descriptors(ctx.permissions())) {
            ObjectNode t = tools.addObject();
            t.put("name", descriptor.name());
            t.put("description", descriptor.description());
            t.set("inputSchema", descriptor.inputSchema());
        }
        return result;
    }

    private RpcResponse callTool(JsonNode id, JsonNode params, ToolContext ctx) {
        String name = params.path("name").asText(null);
        if (name == null || name.isBlank()) {
            return RpcResponse.failure(id, RpcError.of(RpcError.INVALID_PARAMS, "Missing tool name"));
        }
        Optional<Tool> tool = toolRegistry.find(name, ctx.permissions());
        if (tool.isEmpty()) {
            log.debug("Refused tool call {}: {}", name,
                    permissionEvaluator.blockedReason(name, ctx.permissions()).orElse("not registered"));
            return RpcResponse.failure(id, RpcError.of(RpcError.INVALID_PARAMS, "Unknown tool: " + name));
        }

        JsonNode arguments = params.path("arguments");
        if (!arguments.isObject()) {
            arguments = mapper.createObjectNode();
        }
        long start = System.currentTimeMillis();
        try {
            ToolResult result = tool.get().execute(ctx, arguments);
            log.debug("Tool {} finished in {}ms (success={})", name, System.currentTimeMillis() - start,
                    result.success());
            return RpcResponse.success(id, result.success()
                    ? content(render(result.output()), false)
                    : content(result.error(), true));
        } catch (IterableApiException e) {
            return RpcResponse.success(id, content(renderApiError(e), true));
        } catch (RuntimeException e) {
            log.error("Tool {} failed", name, e);
            return RpcResponse.success(id, content("Tool execution failed: " + e.getMessage(), true));
        }
    }

    private JsonNode content(String text, boolean isError) {
        return mapper.valueToTree(isError ? ToolCallResult.error(text) : ToolCallResult.text(text));
    }

    private String render(JsonNode output) {
        if (output == null || output.isNull()) {
            return "{}";
        }
        if (output.isTextual()) {
            return output.asText();
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(output);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize tool output", e);
        }
    }

    private String renderApiError(IterableApiException e) {
        ObjectNode error = mapper.createObjectNode();
        error.put("error", e.getMessage());
        error.put("status", e.getStatus());
        error.put("statusText", e.getStatusText());
        error.put("body", e.getBody() != null ? String.valueOf(e.getBody()) : "");
        return render(error);
    }
}
