package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetMessageTypesTool extends IterableTool {

    @Override public String name() { return "get_message_types"; }
    @Override public String description() { return "Get all available message types"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.empty();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getMessageTypes(credential);
    }
}
