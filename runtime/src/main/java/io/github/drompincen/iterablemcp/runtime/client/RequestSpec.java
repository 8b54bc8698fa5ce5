package io.github.drompincen.iterablemcp.runtime.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Uniform description of one upstream call. Query values may be scalars,
 * collections (sent as repeated keys) or null (omitted).
 */
public record RequestSpec(
        String method,
        String path,
        Map<String, Object> queryParams,
        Object body
) {
    public RequestSpec {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        queryParams = queryParams == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
    }

    public static Builder get(String path) {
        return new Builder("GET", path);
    }

    public static Builder post(String path) {
        return new Builder("POST", path);
    }

    public static Builder builder(String method, String path) {
        return new Builder(method, path);
    }

    /** Renders {@code key=value} pairs joined by {@code &}, or an empty string when none survive. */
    public String queryString() {
        List<String> pairs = new ArrayList<>();
        for (Map.Entry<String, Object> entry : queryParams.entrySet()) {
            Object value = entry.getValue();
            if (value == null) continue;
            if (value instanceof Collection<?> values) {
                for (Object v : values) {
                    if (v != null) pairs.add(pair(entry.getKey(), v));
                }
            } else if (value.getClass().isArray()) {
                throw new IllegalArgumentException("Use a List for multi-value parameter '" + entry.getKey() + "'");
            } else {
                pairs.add(pair(entry.getKey(), value));
            }
        }
        return String.join("&", pairs);
    }

    public String toUrl(String baseUrl) {
        String query = queryString();
        return query.isEmpty() ? baseUrl + path : baseUrl + path + "?" + query;
    }

    /** Percent-encodes a single path segment supplied by a caller. */
    public static String pathSegment(Object value) {
        return URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String pair(String key, Object value) {
        return URLEncoder.encode(key, StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8);
    }

    public static final class Builder {
        private final String method;
        private final String path;
        private final Map<String, Object> params = new LinkedHashMap<>();
        private Object body;

        private Builder(String method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder param(String name, Object value) {
            params.put(name, value);
            return this;
        }

        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        public RequestSpec build() {
            return new RequestSpec(method, path, params, body);
        }
    }
}
