package io.github.drompincen.iterablemcp.runtime.tools;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultTest {

    @Test
    void successCreatesSuccessfulResult() {
        ToolResult result = ToolResult.success(new TextNode("id,sends\n1,10"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().asText()).isEqualTo("id,sends\n1,10");
        assertThat(result.error()).isNull();
    }

    @Test
    void failureCreatesFailedResult() {
        ToolResult result = ToolResult.failure("'listId' is required");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("'listId' is required");
        assertThat(result.output()).isNull();
    }
}
