package io.github.drompincen.iterablemcp.protocol.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of {@code tools/call}: a list of content items, flagged with
 * {@code isError} when the tool or the upstream call failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallResult(
        List<Content> content,
        @JsonProperty("isError") Boolean isError
) {
    public record Content(String type, String text) {}

    public static ToolCallResult text(String text) {
        return new ToolCallResult(List.of(new Content("text", text)), null);
    }

    public static ToolCallResult error(String text) {
        return new ToolCallResult(List.of(new Content("text", text)), true);
    }
}
