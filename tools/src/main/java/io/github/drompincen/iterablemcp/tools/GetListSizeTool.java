package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetListSizeTool extends IterableTool {

    @Override public String name() { return "get_list_size"; }
    @Override public String description() { return "Get the number of users in a list"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("listId", "List ID to get size for")
                .required("listId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getListSize(credential, requireLong(input, "listId"));
    }
}
