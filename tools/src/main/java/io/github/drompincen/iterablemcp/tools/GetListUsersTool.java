package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetListUsersTool extends IterableTool {

    @Override public String name() { return "get_list_users"; }
    @Override public String description() { return "Get users in a list (returns email addresses)"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("listId", "List ID to get users from")
                .boundedInteger("maxResults", "Max users to return", 1, null)
                .required("listId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getListUsers(credential, requireLong(input, "listId"), optInt(input, "maxResults"));
    }
}
