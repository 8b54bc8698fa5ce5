package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetInAppTemplateTool extends IterableTool {

    @Override public String name() { return "get_inapp_template"; }
    @Override public String description() { return "Get details for a specific in-app message template by ID"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("templateId", "In-app template ID to retrieve")
                .string("locale", null)
                .required("templateId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getInAppTemplate(credential, requireLong(input, "templateId"), optString(input, "locale"));
    }
}
