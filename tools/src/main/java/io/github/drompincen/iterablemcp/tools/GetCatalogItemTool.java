package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetCatalogItemTool extends IterableTool {

    @Override public String name() { return "get_catalog_item"; }
    @Override public String description() { return "Get a specific item from a catalog"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .string("catalogName", "Name of the catalog")
                .string("itemId", "ID of the item to retrieve")
                .required("catalogName", "itemId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getCatalogItem(credential, requireString(input, "catalogName"), requireString(input, "itemId"));
    }
}
