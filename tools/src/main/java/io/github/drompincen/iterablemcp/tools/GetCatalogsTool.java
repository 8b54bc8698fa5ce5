package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetCatalogsTool extends IterableTool {

    @Override public String name() { return "get_catalogs"; }
    @Override public String description() { return "Get all catalogs in the project"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.empty();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getCatalogs(credential);
    }
}
