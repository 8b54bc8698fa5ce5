package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetChildCampaignsTool extends IterableTool {

    @Override public String name() { return "get_child_campaigns"; }
    @Override public String description() { return "Get child campaigns of a recurring campaign"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("id", "ID of the recurring campaign")
                .boundedInteger("page", null, 1, null)
                .boundedInteger("pageSize", null, 1, 1000)
                .required("id")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getChildCampaigns(credential, requireLong(input, "id"),
                optInt(input, "page"), optInt(input, "pageSize"));
    }
}
