package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetCampaignTool extends IterableTool {

    @Override public String name() { return "get_campaign"; }
    @Override public String description() { return "Get detailed information about a specific campaign by ID"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("id", "Campaign ID to retrieve")
                .required("id")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getCampaign(credential, requireLong(input, "id"));
    }
}
