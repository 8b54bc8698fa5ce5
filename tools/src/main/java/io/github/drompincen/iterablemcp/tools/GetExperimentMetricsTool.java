package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import com.fasterxml.jackson.databind.JsonNode;

public class GetExperimentMetricsTool extends IterableTool {

    @Override public String name() { return "get_experiment_metrics"; }
    @Override public String description() { return "Get metrics for a specific experiment"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .integer("experimentId", "Experiment ID to get metrics for")
                .required("experimentId")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getExperimentMetrics(credential, requireLong(input, "experimentId"));
    }
}
