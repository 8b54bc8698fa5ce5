package io.github.drompincen.iterablemcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Fluent builder for the JSON schema objects that describe tool arguments.
 */
final class InputSchema {

    private final ObjectNode schema = JsonNodeFactory.instance.objectNode();
    private final ObjectNode props;
    private final ArrayNode required;

    private InputSchema() {
        schema.put("type", "object");
        props = schema.putObject("properties");
        required = schema.putArray("required");
    }

    static InputSchema object() {
        return new InputSchema();
    }

    static JsonNode empty() {
        return object().build();
    }

    InputSchema string(String name, String description) {
        property(name, "string", description);
        return this;
    }

    InputSchema email(String name, String description) {
        property(name, "string", description).put("format", "email");
        return this;
    }

    InputSchema integer(String name, String description) {
        property(name, "integer", description);
        return this;
    }

    InputSchema boundedInteger(String name, String description, int min, Integer max) {
        ObjectNode p = property(name, "integer", description).put("minimum", min);
        if (max != null) p.put("maximum", max);
        return this;
    }

    InputSchema integerArray(String name, String description) {
        property(name, "array", description).putObject("items").put("type", "integer");
        return this;
    }

    InputSchema required(String... names) {
        for (String n : names) required.add(n);
        return this;
    }

    JsonNode build() {
        if (required.isEmpty()) schema.remove("required");
        return schema;
    }

    private ObjectNode property(String name, String type, String description) {
        ObjectNode p = props.putObject(name).put("type", type);
        if (description != null) p.put("description", description);
        return p;
    }
}
