package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetCatalogItemsTool extends IterableTool {

    @Override public String name() { return "get_catalog_items"; }
    @Override public String description() { return "Get items from a specific catalog"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .string("catalogName", "Name of the catalog")
                .boundedInteger("page", null, 1, null)
                .boundedInteger("pageSize", null, 1, 1000)
                .required("catalogName")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getCatalogItems(credential, requireString(input, "catalogName"),
                optInt(input, "page"), optInt(input, "pageSize"));
    }
}
