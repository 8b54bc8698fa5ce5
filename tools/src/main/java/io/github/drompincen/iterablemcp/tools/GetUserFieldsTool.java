package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetUserFieldsTool extends IterableTool {

    @Override public String name() { return "get_user_fields"; }
    @Override public String description() { return "Get all available user data fields in the project"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.empty();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getUserFields(credential);
    }
}
