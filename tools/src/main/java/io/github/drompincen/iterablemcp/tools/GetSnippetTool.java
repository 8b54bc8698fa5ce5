package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetSnippetTool extends IterableTool {

    @Override public String name() { return "get_snippet"; }
    @Override public String description() { return "Get a specific code snippet by ID"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("id", "Snippet ID to retrieve")
                .required("id")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getSnippet(credential, requireLong(input, "id"));
    }
}
