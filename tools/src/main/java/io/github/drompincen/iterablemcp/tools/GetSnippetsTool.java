package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetSnippetsTool extends IterableTool {

    @Override public String name() { return "get_snippets"; }
    @Override public String description() { return "Get all code snippets in the project"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.empty();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getSnippets(credential);
    }
}
