package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetUserByUserIdTool extends IterableTool {

    @Override public String name() { return "get_user_by_user_id"; }
    @Override public String description() { return "Look up a user by user ID"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .string("userId", "User's unique ID")
                .required("userId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getUserByUserId(credential, requireString(input, "userId"));
    }
}
