package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetUserByEmailTool extends IterableTool {

    @Override public String name() { return "get_user_by_email"; }
    @Override public String description() { return "Look up a user by email address"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .email("email", "User's email address")
                .required("email")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getUserByEmail(credential, requireString(input, "email"));
    }
}
