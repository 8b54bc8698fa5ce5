package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import io.github.drompincen.iterablemcp.protocol.api.CredentialSource;
import io.github.drompincen.iterablemcp.protocol.api.PermissionConfig;
import io.github.drompincen.iterablemcp.runtime.client.IterableClient;
import io.github.drompincen.iterablemcp.runtime.tools.ToolContext;
import io.github.drompincen.iterablemcp.runtime.tools.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GetCampaignMetricsToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Credential KEY = new Credential("k-123", CredentialSource.QUERY);

    @Mock private IterableClient client;

    private GetCampaignMetricsTool tool;
    private ToolContext ctx;

    @BeforeEach
    void setUp() {
        tool = new GetCampaignMetricsTool();
        tool.setIterableClient(client);
        ctx = new ToolContext(KEY, PermissionConfig.lockedDown());
    }

    @Test
    void failsWithoutClient() {
        GetCampaignMetricsTool unwired = new GetCampaignMetricsTool();
        ObjectNode input = MAPPER.createObjectNode().put("campaignId", 42);

        ToolResult result = unwired.execute(ctx, input);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("IterableClient not available");
    }

    @Test
    void failsWithoutCredential() {
        ObjectNode input = MAPPER.createObjectNode().put("campaignId", 42);

        ToolResult result = tool.execute(new ToolContext(null, PermissionConfig.lockedDown()), input);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("API key");
        verifyNoInteractions(client);
    }

    @Test
    void failsWithoutCampaignId() {
        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("'campaignId' is required");
        verifyNoInteractions(client);
    }

    @Test
    void passesDateRangeThrough() {
        when(client.getCampaignMetrics(KEY, 42L, "2024-01-01 00:00:00", null))
                .thenReturn(new TextNode("id,sends\n42,10"));
        ObjectNode input = MAPPER.createObjectNode()
                .put("campaignId", 42)
                .put("startDateTime", "2024-01-01 00:00:00");

        ToolResult result = tool.execute(ctx, input);

        assertThat(result.success()).isTrue();
        assertThat(result.output().asText()).isEqualTo("id,sends\n42,10");
    }

    @Test
    void acceptsNumericStringId() {
        when(client.getCampaignMetrics(KEY, 42L, null, null)).thenReturn(new TextNode("id\n42"));

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("campaignId", "42"));

        assertThat(result.success()).isTrue();
    }

    @Test
    void nonNumericIdIsRejected() {
        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("campaignId", "forty-two"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("'campaignId' must be an integer");
        verifyNoInteractions(client);
    }

    @Test
    void objectDateIsRejected() {
        ObjectNode input = MAPPER.createObjectNode().put("campaignId", 42);
        input.putObject("startDateTime").put("year", 2024);

        ToolResult result = tool.execute(ctx, input);

        assertThat(result.error()).isEqualTo("'startDateTime' must be a string");
        verifyNoInteractions(client);
    }
}
