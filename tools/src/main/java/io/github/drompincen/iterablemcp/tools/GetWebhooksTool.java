package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetWebhooksTool extends IterableTool {

    @Override public String name() { return "get_webhooks"; }
    @Override public String description() { return "Get all webhooks configured in the project"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.empty();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getWebhooks(credential);
    }
}
