package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetCampaignsTool extends IterableTool {

    @Override public String name() { return "get_campaigns"; }
    @Override public String description() { return "Retrieve campaigns with optional filtering and pagination"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .boundedInteger("page", "Page number (starting at 1)", 1, null)
                .boundedInteger("pageSize", "Results per page (max 1000)", 1, 1000)
                .string("sort", "Field to sort by with optional direction (e.g. 'id', 'name:desc')")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getCampaigns(credential, optInt(input, "page"), optInt(input, "pageSize"), optString(input, "sort"));
    }
}
