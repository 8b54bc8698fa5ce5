package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetCampaignMetricsTool extends IterableTool {

    @Override public String name() { return "get_campaign_metrics"; }
    @Override public String description() { return "Get campaign performance metrics (CSV format)"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("campaignId", "Campaign ID to get metrics for")
                .string("startDateTime", "Start date (YYYY-MM-DD HH:MM:SS)")
                .string("endDateTime", "End date (YYYY-MM-DD HH:MM:SS)")
                .required("campaignId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getCampaignMetrics(credential, requireLong(input, "campaignId"),
                optString(input, "startDateTime"), optString(input, "endDateTime"));
    }
}
