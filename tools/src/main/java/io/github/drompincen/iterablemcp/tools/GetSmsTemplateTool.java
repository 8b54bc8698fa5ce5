package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetSmsTemplateTool extends IterableTool {

    @Override public String name() { return "get_sms_template"; }
    @Override public String description() { return "Get details for a specific SMS template by ID"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("templateId", "SMS template ID to retrieve")
                .string("locale", null)
                .required("templateId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getSmsTemplate(credential, requireLong(input, "templateId"), optString(input, "locale"));
    }
}
