package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetEmailTemplateTool extends IterableTool {

    @Override public String name() { return "get_email_template"; }
    @Override public String description() { return "Get details for a specific email template by ID"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("templateId", "Email template ID to retrieve")
                .string("locale", "Locale for localized templates")
                .required("templateId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getEmailTemplate(credential, requireLong(input, "templateId"), optString(input, "locale"));
    }
}
