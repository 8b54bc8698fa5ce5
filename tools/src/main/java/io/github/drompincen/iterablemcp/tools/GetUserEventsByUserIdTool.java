package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetUserEventsByUserIdTool extends IterableTool {

    @Override public String name() { return "get_user_events_by_user_id"; }
    @Override public String description() { return "Get events for a user by user ID"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .string("userId", "User's unique ID")
                .boundedInteger("limit", "Max events to return", 1, null)
                .required("userId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getUserEventsByUserId(credential, requireString(input, "userId"), optInt(input, "limit"));
    }
}
