package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetListsTool extends IterableTool {

    @Override public String name() { return "get_lists"; }
    @Override public String description() { return "Get all subscriber lists in the project"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.empty();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getLists(credential);
    }
}
