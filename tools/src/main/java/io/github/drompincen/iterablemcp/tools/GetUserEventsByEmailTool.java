package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetUserEventsByEmailTool extends IterableTool {

    @Override public String name() { return "get_user_events_by_email"; }
    @Override public String description() { return "Get events for a user by email"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .email("email", "User's email address")
                .boundedInteger("limit", "Max events to return", 1, null)
                .required("email")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getUserEventsByEmail(credential, requireString(input, "email"), optInt(input, "limit"));
    }
}
