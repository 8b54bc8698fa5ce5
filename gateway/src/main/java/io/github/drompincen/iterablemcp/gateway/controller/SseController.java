package io.github.drompincen.iterablemcp.gateway.controller;

import io.github.drompincen.iterablemcp.gateway.config.PermissionSettings;
import io.github.drompincen.iterablemcp.gateway.filter.ApiKeyFilter;
import io.github.drompincen.iterablemcp.protocol.api.Credential;
import io.github.drompincen.iterablemcp.protocol.rpc.RpcRequest;
import io.github.drompincen.iterablemcp.protocol.rpc.RpcResponse;
import io.github.drompincen.iterablemcp.runtime.mcp.McpDispatcher;
import io.github.drompincen.iterablemcp.runtime.tools.ToolContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Legacy event-stream transport. A client opens {@code GET /sse}, receives an
 * {@code endpoint} event naming its message URL, and posts JSON-RPC messages there;
 * responses are pushed back over the stream as {@code message} events.
 */
@RestController
@RequestMapping("/sse")
public class SseController {

    private static final Logger log = LoggerFactory.getLogger(SseController.class);
    private static final long STREAM_TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    private final McpDispatcher dispatcher;
    private final PermissionSettings permissionSettings;
    private final ObjectMapper objectMapper;
    private final Map<String, SseEmitter> streams = new ConcurrentHashMap<>();

    public SseController(McpDispatcher dispatcher, PermissionSettings permissionSettings,
                         ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.permissionSettings = permissionSettings;
        this.objectMapper = objectMapper;
    }

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter open() throws IOException {
        String sessionId = UUID.randomUUID().toString();
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        streams.put(sessionId, emitter);
        emitter.onCompletion(() -> streams.remove(sessionId));
        emitter.onTimeout(() -> streams.remove(sessionId));
        emitter.onError(e -> streams.remove(sessionId));
        emitter.send(SseEmitter.event().name("endpoint").data("/sse/message?sessionId=" + sessionId));
        log.debug("Opened event stream {}", sessionId);
        return emitter;
    }

    @PostMapping(path = "/message", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> message(
            @RequestParam String sessionId,
            @RequestBody RpcRequest request,
            @RequestAttribute(name = ApiKeyFilter.CREDENTIAL_ATTRIBUTE, required = false) Credential credential) {
        SseEmitter emitter = streams.get(sessionId);
        if (emitter == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Unknown session");
        }
        ToolContext ctx = new ToolContext(credential, permissionSettings.current());
        Optional<RpcResponse> response = dispatcher.dispatch(request, ctx);
        if (response.isPresent()) {
            try {
                emitter.send(SseEmitter.event()
                        .name("message")
                        .data(objectMapper.writeValueAsString(response.get()), MediaType.TEXT_PLAIN));
            } catch (IOException e) {
                log.warn("Event stream {} is gone: {}", sessionId, e.getMessage());
                streams.remove(sessionId);
                emitter.completeWithError(e);
                return ResponseEntity.status(HttpStatus.GONE).body("Session closed");
            }
        }
        return ResponseEntity.accepted().body("Accepted");
    }

    int openStreams() {
        return streams.size();
    }
}
