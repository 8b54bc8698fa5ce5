package io.github.drompincen.iterablemcp.gateway.controller;

import io.github.drompincen.iterablemcp.runtime.credential.CredentialResolver;
import io.github.drompincen.iterablemcp.runtime.mcp.McpDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class InfoController {

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "Iterable MCP Server");
        body.put("version", McpDispatcher.SERVER_VERSION);
        body.put("endpoints", Map.of(
                "mcp", "/mcp?" + CredentialResolver.QUERY_PARAM + "=YOUR_KEY (recommended)",
                "sse", "/sse?" + CredentialResolver.QUERY_PARAM + "=YOUR_KEY (legacy)"));
        body.put("authentication", Map.of(
                "methods", List.of(
                        "Query parameter (" + CredentialResolver.QUERY_PARAM + ")",
                        "Header (" + CredentialResolver.HEADER + ")")));
        return ResponseEntity.ok()
                .header("Access-Control-Allow-Origin", "*")
                .body(body);
    }
}
