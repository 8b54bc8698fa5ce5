package io.github.drompincen.iterablemcp.gateway.controller;

import io.github.drompincen.iterablemcp.protocol.rpc.RpcError;
import io.github.drompincen.iterablemcp.protocol.rpc.RpcResponse;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(assignableTypes = {McpController.class, SseController.class})
public class RpcExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RpcExceptionHandler.class);

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<RpcResponse> unreadable(HttpMessageNotReadableException e) {
        log.debug("Unparseable JSON-RPC message: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(RpcResponse.failure(NullNode.getInstance(), RpcError.of(RpcError.PARSE_ERROR, "Parse error")));
    }
}
