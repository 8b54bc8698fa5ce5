package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetChannelsTool extends IterableTool {

    @Override public String name() { return "get_channels"; }
    @Override public String description() { return "Get all available message channels"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.empty();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getChannels(credential);
    }
}
