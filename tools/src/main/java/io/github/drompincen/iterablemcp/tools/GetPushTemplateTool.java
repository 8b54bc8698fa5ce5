package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetPushTemplateTool extends IterableTool {

    @Override public String name() { return "get_push_template"; }
    @Override public String description() { return "Get details for a specific push notification template by ID"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("templateId", "Push template ID to retrieve")
                .string("locale", null)
                .required("templateId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getPushTemplate(credential, requireLong(input, "templateId"), optString(input, "locale"));
    }
}
