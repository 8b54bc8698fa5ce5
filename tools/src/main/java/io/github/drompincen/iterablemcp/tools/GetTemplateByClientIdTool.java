package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetTemplateByClientIdTool extends IterableTool {

    @Override public String name() { return "get_template_by_client_id"; }
    @Override public String description() { return "Get template by client template ID"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .string("clientTemplateId", "Client template ID to look up")
                .required("clientTemplateId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getTemplateByClientId(credential, requireString(input, "clientTemplateId"));
    }
}
