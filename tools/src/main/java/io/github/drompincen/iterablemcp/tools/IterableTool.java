package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import io.github.drompincen.iterablemcp.protocol.api.ToolCapability;
import io.github.drompincen.iterablemcp.runtime.client.IterableClient;
import io.github.drompincen.iterablemcp.runtime.policy.CapabilityTaxonomy;
import io.github.drompincen.iterablemcp.runtime.tools.Tool;
import io.github.drompincen.iterablemcp.runtime.tools.ToolContext;
import io.github.drompincen.iterablemcp.runtime.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Base for tools that map their arguments onto a single {@link IterableClient} call.
 * Upstream failures propagate as {@code IterableApiException}; missing arguments
 * and wrong-typed arguments become a failed {@link ToolResult}.
 */
public abstract class IterableTool implements Tool {

    private JsonNode schema;
    protected IterableClient client;

    public void setIterableClient(IterableClient client) {
        this.client = client;
    }

    @Override
    public JsonNode inputSchema() {
        if (schema == null) {
            schema = buildSchema();
        }
        return schema;
    }

    @Override
    public Set<ToolCapability> capabilities() {
        return CapabilityTaxonomy.capabilitiesOf(name());
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (client == null) return ToolResult.failure("IterableClient not available");
        if (ctx.credential() == null) return ToolResult.failure("An Iterable API key is required");
        try {
            return ToolResult.success(invoke(ctx.credential(), input));
        } catch (ArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    protected abstract JsonNode buildSchema();

    protected abstract JsonNode invoke(Credential credential, JsonNode input);

    protected static long requireLong(JsonNode input, String field) {
        JsonNode v = input.path(field);
        if (v.isMissingNode() || v.isNull()) throw ArgumentException.missing(field);
        Long value = integral(v);
        if (value == null) throw ArgumentException.invalid(field, "an integer");
        return value;
    }

    protected static String requireString(JsonNode input, String field) {
        String value = optString(input, field);
        if (value == null || value.isBlank()) throw ArgumentException.missing(field);
        return value;
    }

    protected static String optString(JsonNode input, String field) {
        JsonNode v = input.path(field);
        if (v.isMissingNode() || v.isNull()) return null;
        if (v.isContainerNode()) throw ArgumentException.invalid(field, "a string");
        return v.asText();
    }

    protected static Integer optInt(JsonNode input, String field) {
        JsonNode v = input.path(field);
        if (v.isMissingNode() || v.isNull()) return null;
        Long value = integral(v);
        if (value == null || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw ArgumentException.invalid(field, "an integer");
        }
        return value.intValue();
    }

    protected static List<Long> optLongList(JsonNode input, String field) {
        JsonNode v = input.path(field);
        if (v.isMissingNode() || v.isNull()) return null;
        if (!v.isArray()) throw ArgumentException.invalid(field, "an array of integers");
        List<Long> values = new ArrayList<>();
        for (JsonNode element : v) {
            Long value = integral(element);
            if (value == null) throw ArgumentException.invalid(field, "an array of integers");
            values.add(value);
        }
        return values;
    }

    /** Integral numbers and digit-only strings; anything else is null. */
    private static Long integral(JsonNode v) {
        if (v.isIntegralNumber() && v.canConvertToLong()) return v.asLong();
        if (v.isTextual() && v.asText().trim().matches("-?\\d{1,18}")) return Long.parseLong(v.asText().trim());
        return null;
    }

    static final class ArgumentException extends RuntimeException {
        private ArgumentException(String message) {
            super(message);
        }

        static ArgumentException missing(String field) {
            return new ArgumentException("'" + field + "' is required");
        }

        static ArgumentException invalid(String field, String expected) {
            return new ArgumentException("'" + field + "' must be " + expected);
        }
    }
}
