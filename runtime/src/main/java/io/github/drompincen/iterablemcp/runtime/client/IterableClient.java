package io.github.drompincen.iterablemcp.runtime.client;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Blocking client for the Iterable REST API. Every call takes the credential
 * resolved for the current request; the client itself holds no caller state.
 */
@Component
public class IterableClient {

    private static final Logger log = LoggerFactory.getLogger(IterableClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.iterable.com";
    static final String USER_AGENT = "iterable-mcp-gateway/1.0.0";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final ResponseNormalizer normalizer;
    private final String baseUrl;

    public IterableClient(HttpClient httpClient, ObjectMapper mapper,
                          @Value("${iterable.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.normalizer = new ResponseNormalizer(mapper);
        this.baseUrl = stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Performs one upstream call and returns the normalized body.
     *
     * @throws IterableApiException for non-2xx responses (status preserved) and for
     *                              transport failures (status 0, "Network Error")
     */
    public JsonNode call(RequestSpec spec, Credential credential) {
        if (credential == null) {
            throw new IllegalArgumentException("An API key is required for upstream calls");
        }
        HttpRequest request = buildRequest(spec, credential);
        HttpResponse<String> response;
        long start = System.currentTimeMillis();
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw IterableApiException.network(e);
        } catch (IOException | RuntimeException e) {
            log.warn("Iterable {} call failed before a response: {}", spec.method(), e.getMessage());
            throw IterableApiException.network(e);
        }
        log.debug("Iterable {} -> {} in {}ms", spec.method(), response.statusCode(),
                System.currentTimeMillis() - start);
        try {
            return normalizer.normalize(response.statusCode(), response.body());
        } catch (IterableApiException e) {
            log.warn("Iterable {} returned {} {}", spec.method(), e.getStatus(), e.getStatusText());
            throw e;
        }
    }

    HttpRequest buildRequest(RequestSpec spec, Credential credential) {
        HttpRequest.BodyPublisher publisher = spec.body() != null
                ? HttpRequest.BodyPublishers.ofString(serialize(spec.body()))
                : HttpRequest.BodyPublishers.noBody();
        return HttpRequest.newBuilder()
                .uri(URI.create(spec.toUrl(baseUrl)))
                .header("Api-Key", credential.secret())
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT)
                .method(spec.method(), publisher)
                .build();
    }

    private String serialize(Object body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    // ---- campaigns ----

    public JsonNode getCampaigns(Credential credential, Integer page, Integer pageSize, String sort) {
        return call(RequestSpec.get("/api/campaigns")
                .param("page", page != null ? page : 1)
                .param("pageSize", pageSize != null ? pageSize : 20)
                .param("sort", sort)
                .build(), credential);
    }

    public JsonNode getCampaign(Credential credential, long id) {
        return call(RequestSpec.get("/api/campaigns/" + id).build(), credential);
    }

    /** Metrics come back as CSV and are returned as a text node. */
    public JsonNode getCampaignMetrics(Credential credential, long campaignId,
                                       String startDateTime, String endDateTime) {
        return call(RequestSpec.get("/api/campaigns/metrics")
                .param("campaignId", campaignId)
                .param("startDateTime", startDateTime)
                .param("endDateTime", endDateTime)
                .build(), credential);
    }

    public JsonNode getChildCampaigns(Credential credential, long recurringCampaignId,
                                      Integer page, Integer pageSize) {
        return call(RequestSpec.get("/api/campaigns/recurring/" + recurringCampaignId + "/childCampaigns")
                .param("page", page != null ? page : 1)
                .param("pageSize", pageSize != null ? pageSize : 20)
                .build(), credential);
    }

    // ---- templates ----

    public JsonNode getTemplates(Credential credential, String templateType, String messageMedium,
                                 String startDateTime, String endDateTime) {
        return call(RequestSpec.get("/api/templates")
                .param("templateType", templateType)
                .param("messageMedium", messageMedium)
                .param("startDateTime", startDateTime)
                .param("endDateTime", endDateTime)
                .build(), credential);
    }

    public JsonNode getEmailTemplate(Credential credential, long templateId, String locale) {
        return templateById(credential, "email", templateId, locale);
    }

    public JsonNode getSmsTemplate(Credential credential, long templateId, String locale) {
        return templateById(credential, "sms", templateId, locale);
    }

    public JsonNode getPushTemplate(Credential credential, long templateId, String locale) {
        return templateById(credential, "push", templateId, locale);
    }

    public JsonNode getInAppTemplate(Credential credential, long templateId, String locale) {
        return templateById(credential, "inapp", templateId, locale);
    }

    public JsonNode getTemplateByClientId(Credential credential, String clientTemplateId) {
        return call(RequestSpec.get("/api/templates/getByClientTemplateId")
                .param("clientTemplateId", clientTemplateId)
                .build(), credential);
    }

    private JsonNode templateById(Credential credential, String medium, long templateId, String locale) {
        return call(RequestSpec.get("/api/templates/" + medium + "/get")
                .param("templateId", templateId)
                .param("locale", locale)
                .build(), credential);
    }

    // ---- users ----

    public JsonNode getUserByEmail(Credential credential, String email) {
        return call(RequestSpec.get("/api/users/" + RequestSpec.pathSegment(email)).build(), credential);
    }

    public JsonNode getUserByUserId(Credential credential, String userId) {
        return call(RequestSpec.get("/api/users/byUserId/" + RequestSpec.pathSegment(userId)).build(), credential);
    }

    public JsonNode getUserFields(Credential credential) {
        return call(RequestSpec.get("/api/users/getFields").build(), credential);
    }

    public JsonNode getSentMessages(Credential credential, SentMessagesQuery query) {
        return call(RequestSpec.get("/api/users/getSentMessages")
                .param("email", query.email())
                .param("userId", query.userId())
                .param("limit", query.limit())
                .param("startDateTime", query.startDateTime())
                .param("endDateTime", query.endDateTime())
                .param("messageMedium", query.messageMedium())
                .param("campaignIds", query.campaignIds())
                .build(), credential);
    }

    // ---- lists ----

    public JsonNode getLists(Credential credential) {
        return call(RequestSpec.get("/api/lists").build(), credential);
    }

    /** The size endpoint answers with a bare number. */
    public JsonNode getListSize(Credential credential, long listId) {
        return ResponseNormalizer.toSize(call(RequestSpec.get("/api/lists/" + listId + "/size").build(), credential));
    }

    /** The users endpoint answers with one email per line. */
    public JsonNode getListUsers(Credential credential, long listId, Integer maxResults) {
        return ResponseNormalizer.toUserList(call(RequestSpec.get("/api/lists/getUsers")
                .param("listId", listId)
                .param("maxResults", maxResults)
                .build(), credential));
    }

    // ---- channels ----

    public JsonNode getChannels(Credential credential) {
        return call(RequestSpec.get("/api/channels").build(), credential);
    }

    public JsonNode getMessageTypes(Credential credential) {
        return call(RequestSpec.get("/api/messageTypes").build(), credential);
    }

    // ---- events ----

    public JsonNode getUserEventsByEmail(Credential credential, String email, Integer limit) {
        return call(RequestSpec.get("/api/events")
                .param("email", email)
                .param("limit", limit)
                .build(), credential);
    }

    public JsonNode getUserEventsByUserId(Credential credential, String userId, Integer limit) {
        return call(RequestSpec.get("/api/events")
                .param("userId", userId)
                .param("limit", limit)
                .build(), credential);
    }

    // ---- journeys, experiments, webhooks ----

    public JsonNode getJourneys(Credential credential) {
        return call(RequestSpec.get("/api/journeys").build(), credential);
    }

    public JsonNode getExperimentMetrics(Credential credential, long experimentId) {
        return call(RequestSpec.get("/api/experiments/metrics/" + experimentId).build(), credential);
    }

    public JsonNode getWebhooks(Credential credential) {
        return call(RequestSpec.get("/api/webhooks").build(), credential);
    }

    // ---- snippets ----

    public JsonNode getSnippets(Credential credential) {
        return call(RequestSpec.get("/api/snippets").build(), credential);
    }

    public JsonNode getSnippet(Credential credential, long id) {
        return call(RequestSpec.get("/api/snippets/" + id).build(), credential);
    }

    // ---- catalogs ----

    public JsonNode getCatalogs(Credential credential) {
        return call(RequestSpec.get("/api/catalogs").build(), credential);
    }

    public JsonNode getCatalogItems(Credential credential, String catalogName, Integer page, Integer pageSize) {
        return call(RequestSpec.get("/api/catalogs/" + RequestSpec.pathSegment(catalogName) + "/items")
                .param("page", page)
                .param("pageSize", pageSize)
                .build(), credential);
    }

    public JsonNode getCatalogItem(Credential credential, String catalogName, String itemId) {
        return call(RequestSpec.get("/api/catalogs/" + RequestSpec.pathSegment(catalogName)
                + "/items/" + RequestSpec.pathSegment(itemId)).build(), credential);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
