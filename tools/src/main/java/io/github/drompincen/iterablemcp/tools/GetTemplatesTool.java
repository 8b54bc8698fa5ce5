package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetTemplatesTool extends IterableTool {

    @Override public String name() { return "get_templates"; }
    @Override public String description() { return "Retrieve templates with optional filtering"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .string("templateType", "Filter by template type")
                .string("messageMedium", "Filter by message medium")
                .string("startDateTime", null)
                .string("endDateTime", null)
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getTemplates(credential, optString(input, "templateType"), optString(input, "messageMedium"),
                optString(input, "startDateTime"), optString(input, "endDateTime"));
    }
}
