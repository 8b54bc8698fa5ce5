package io.github.drompincen.iterablemcp.runtime.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.http.HttpStatus;

/**
 * Turns upstream response bodies into JSON trees by sniffing the body, not the
 * content type: empty becomes {@code {}}, parseable JSON passes through, anything
 * else becomes a text node. Shape-specific lifting is left to the caller.
 */
public class ResponseNormalizer {

    private final ObjectMapper mapper;
    // "123,456\n..." must stay text, not parse as 123
    private final ObjectReader strictReader;

    public ResponseNormalizer(ObjectMapper mapper) {
        this.mapper = mapper;
        this.strictReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public JsonNode normalize(int status, String body) {
        if (status < 200 || status >= 300) {
            throw new IterableApiException(status, reasonPhrase(status), body != null ? body : "");
        }
        if (body == null || body.isEmpty()) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode parsed = strictReader.readTree(body);
            // whitespace-only bodies parse to nothing
            return parsed == null || parsed.isMissingNode() ? TextNode.valueOf(body) : parsed;
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    /** Lifts a bare numeric body into {@code {"size": n}}; a non-numeric body yields {@code {"size": null}}. */
    public static ObjectNode toSize(JsonNode node) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        if (node.isIntegralNumber()) {
            result.put("size", node.asLong());
            return result;
        }
        try {
            result.put("size", Long.parseLong(node.asText().trim(), 10));
        } catch (NumberFormatException e) {
            result.putNull("size");
        }
        return result;
    }

    /** Lifts a newline-delimited email body into {@code {"users":[{"email":...}]}}; structured JSON passes through. */
    public static JsonNode toUserList(JsonNode node) {
        if (!node.isTextual()) {
            return node;
        }
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ArrayNode users = result.putArray("users");
        for (String line : node.asText().split("\n")) {
            String email = line.trim();
            if (!email.isEmpty()) {
                users.addObject().put("email", email);
            }
        }
        return result;
    }

    static String reasonPhrase(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved != null ? resolved.getReasonPhrase() : "";
    }
}
