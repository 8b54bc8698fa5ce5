package io.github.drompincen.iterablemcp.gateway.filter;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import io.github.drompincen.iterablemcp.runtime.credential.CredentialResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the caller's Iterable API key and exposes it as a request attribute.
 * Protected routes without any key are answered with 401 before reaching a controller.
 */
@Component
public class ApiKeyFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);

    public static final String CREDENTIAL_ATTRIBUTE = "io.github.drompincen.iterablemcp.gateway.filter.ApiKeyFilter.credential";

    private final CredentialResolver credentialResolver;
    private final ObjectMapper objectMapper;

    public ApiKeyFilter(CredentialResolver credentialResolver, ObjectMapper objectMapper) {
        this.credentialResolver = credentialResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        // decoded, with ";" parameters stripped, as handler mapping sees it
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        Optional<Credential> credential = credentialResolver.resolve(
                request.getParameter(CredentialResolver.QUERY_PARAM),
                request.getHeader(CredentialResolver.HEADER));

        if (credential.isEmpty() && credentialResolver.requiresCredential(path)) {
            log.debug("Rejected {} {}: no API key", request.getMethod(), path);
            writeUnauthorized(response);
            return;
        }
        credential.ifPresent(c -> {
            request.setAttribute(CREDENTIAL_ATTRIBUTE, c);
            log.debug("API key for {} taken from {}", path, c.source());
        });
        chain.doFilter(request, response);
    }

    private void writeUnauthorized(HttpServletResponse response) throws IOException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", "API key required");
        body.put("message", "Provide your Iterable API key via " + CredentialResolver.HEADER
                + " header or ?" + CredentialResolver.QUERY_PARAM + " query parameter");
        body.put("example", "/mcp?" + CredentialResolver.QUERY_PARAM + "=YOUR_KEY");
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
