package io.github.drompincen.iterablemcp.runtime.client;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import io.github.drompincen.iterablemcp.protocol.api.CredentialSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IterableClientTest {

    private static final Credential KEY = new Credential("test-api-key", CredentialSource.QUERY);

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock private HttpClient httpClient;
    @Mock private HttpResponse<String> response;

    private IterableClient client;

    @BeforeEach
    void setUp() {
        client = new IterableClient(httpClient, mapper, "https://api.iterable.com");
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private void respond(int status, String body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }

    @Test
    void sendsCredentialAndJsonHeaders() throws Exception {
        respond(200, "{\"campaigns\":[]}");

        client.getCampaigns(KEY, null, null, null);

        HttpRequest request = sentRequest();
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.headers().firstValue("Api-Key")).contains("test-api-key");
        assertThat(request.headers().firstValue("Content-Type")).contains("application/json");
        assertThat(request.headers().firstValue("User-Agent")).contains(IterableClient.USER_AGENT);
    }

    @Test
    void campaignsDefaultToFirstPageOfTwenty() throws Exception {
        respond(200, "{\"campaigns\":[],\"totalCampaignsCount\":0}");

        client.getCampaigns(KEY, null, null, null);

        assertThat(sentRequest().uri().toString())
                .isEqualTo("https://api.iterable.com/api/campaigns?page=1&pageSize=20");
    }

    @Test
    void campaignsAcceptCustomPaging() throws Exception {
        respond(200, "{\"campaigns\":[]}");

        client.getCampaigns(KEY, 2, 50, null);

        assertThat(sentRequest().uri().toString()).contains("page=2").contains("pageSize=50");
    }

    @Test
    void campaignByIdUsesPathSegment() throws Exception {
        respond(200, "{\"id\":123,\"name\":\"Test Campaign\"}");

        JsonNode result = client.getCampaign(KEY, 123);

        assertThat(sentRequest().uri().toString()).isEqualTo("https://api.iterable.com/api/campaigns/123");
        assertThat(result.get("name").asText()).isEqualTo("Test Campaign");
    }

    @Test
    void jsonObjectIsReturnedUnchanged() throws Exception {
        respond(200, "{\"campaigns\":[{\"id\":1,\"name\":\"Test\"}]}");

        JsonNode result = client.getCampaigns(KEY, null, null, null);

        assertThat(result).isEqualTo(mapper.readTree("{\"campaigns\":[{\"id\":1,\"name\":\"Test\"}]}"));
    }

    @Test
    void emptyBodyBecomesEmptyObject() throws Exception {
        respond(200, "");

        JsonNode result = client.getCampaigns(KEY, null, null, null);

        assertThat(result.isObject()).isTrue();
        assertThat(result.size()).isZero();
    }

    @Test
    void metricsCsvIsReturnedAsText() throws Exception {
        String csv = "id,sends,opens\n42,100,55\n";
        respond(200, csv);

        JsonNode result = client.getCampaignMetrics(KEY, 42, "2024-01-01 00:00:00", null);

        assertThat(result.isTextual()).isTrue();
        assertThat(result.asText()).isEqualTo(csv);
        assertThat(sentRequest().uri().toString())
                .isEqualTo("https://api.iterable.com/api/campaigns/metrics?campaignId=42&startDateTime=2024-01-01+00%3A00%3A00");
    }

    @Test
    void listSizeParsesBareNumber() throws Exception {
        respond(200, "1234");

        JsonNode result = client.getListSize(KEY, 7);

        assertThat(result.get("size").asLong()).isEqualTo(1234L);
        assertThat(sentRequest().uri().getPath()).isEqualTo("/api/lists/7/size");
    }

    @Test
    void listUsersSplitsLines() throws Exception {
        respond(200, "a@x.com\nb@x.com\n\n");

        JsonNode result = client.getListUsers(KEY, 9, 100);

        assertThat(result).isEqualTo(mapper.readTree(
                "{\"users\":[{\"email\":\"a@x.com\"},{\"email\":\"b@x.com\"}]}"));
        assertThat(sentRequest().uri().getQuery()).isEqualTo("listId=9&maxResults=100");
    }

    @Test
    void sentMessagesRepeatCampaignIds() throws Exception {
        respond(200, "{\"messages\":[]}");

        client.getSentMessages(KEY, new SentMessagesQuery(
                "a@x.com", null, 10, List.of(1L, 2L, 3L), null, null, null));

        String url = sentRequest().uri().toString();
        assertThat(url).contains("campaignIds=1&campaignIds=2&campaignIds=3");
        assertThat(url).doesNotContain("campaignIds=1,2,3");
        assertThat(url).contains("email=a%40x.com").contains("limit=10");
        assertThat(url).doesNotContain("userId=");
    }

    @Test
    void userEmailIsEncodedInPath() throws Exception {
        respond(200, "{\"user\":{}}");

        client.getUserByEmail(KEY, "first+last@x.com");

        assertThat(sentRequest().uri().getRawPath()).isEqualTo("/api/users/first%2Blast%40x.com");
    }

    @Test
    void templateLookupsUseMediumPath() throws Exception {
        respond(200, "{}");

        client.getInAppTemplate(KEY, 55, "fr");

        assertThat(sentRequest().uri().toString())
                .isEqualTo("https://api.iterable.com/api/templates/inapp/get?templateId=55&locale=fr");
    }

    @Test
    void notFoundRaisesApiError() throws Exception {
        respond(404, "{\"msg\":\"Campaign not found\"}");

        assertThatThrownBy(() -> client.getCampaign(KEY, 999))
                .isInstanceOfSatisfying(IterableApiException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(404);
                    assertThat(e.getStatusText()).isEqualTo("Not Found");
                    assertThat(e.getBody()).isEqualTo("{\"msg\":\"Campaign not found\"}");
                    assertThat(e.isNetworkError()).isFalse();
                });
    }

    @Test
    void unauthorizedRaisesApiError() throws Exception {
        respond(401, "Invalid API key");

        assertThatThrownBy(() -> client.getLists(KEY))
                .isInstanceOfSatisfying(IterableApiException.class, e -> assertThat(e.getStatus()).isEqualTo(401));
    }

    @Test
    void transportFailureBecomesNetworkError() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any())).thenThrow(new ConnectException("Connection refused"));

        assertThatThrownBy(() -> client.getLists(KEY))
                .isInstanceOfSatisfying(IterableApiException.class, e -> {
                    assertThat(e.getStatus()).isZero();
                    assertThat(e.getStatusText()).isEqualTo("Network Error");
                    assertThat(e.getBody()).isEqualTo("Connection refused");
                    assertThat(e.getCause()).isInstanceOf(IOException.class);
                });
    }

    @Test
    void interruptBecomesNetworkErrorAndKeepsFlag() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any())).thenThrow(new InterruptedException("interrupted"));

        assertThatThrownBy(() -> client.getLists(KEY))
                .isInstanceOfSatisfying(IterableApiException.class, e -> assertThat(e.isNetworkError()).isTrue());
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void missingCredentialNeverReachesUpstream() throws Exception {
        assertThatThrownBy(() -> client.getLists(null)).isInstanceOf(IllegalArgumentException.class);

        verify(httpClient, never()).send(any(HttpRequest.class), any());
    }

    @Test
    void bodyIsSerializedAsJson() throws Exception {
        respond(200, "{}");

        client.call(RequestSpec.post("/api/lists").body(Map.of("name", "VIPs")).build(), KEY);

        HttpRequest request = sentRequest();
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.bodyPublisher()).isPresent();
        assertThat(request.bodyPublisher().get().contentLength())
                .isEqualTo(mapper.writeValueAsBytes(Map.of("name", "VIPs")).length);
    }

    @Test
    void unserializableBodyIsNotANetworkError() throws Exception {
        RequestSpec spec = RequestSpec.post("/api/lists").body(new Object()).build();

        assertThatThrownBy(() -> client.call(spec, KEY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Request body is not serializable");
        verify(httpClient, never()).send(any(HttpRequest.class), any());
    }

    @Test
    void trailingSlashOnBaseUrlIsDropped() throws Exception {
        client = new IterableClient(httpClient, mapper, "https://api.eu.iterable.com/");
        respond(200, "{}");

        client.getJourneys(KEY);

        assertThat(sentRequest().uri().toString()).isEqualTo("https://api.eu.iterable.com/api/journeys");
    }

    @Test
    void blankBaseUrlFallsBackToDefault() {
        IterableClient defaulted = new IterableClient(httpClient, mapper, " ");

        assertThat(defaulted.baseUrl()).isEqualTo(IterableClient.DEFAULT_BASE_URL);
    }
}
