package io.github.drompincen.iterablemcp.gateway;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {
        "iterable.api-key=",
        "iterable.permissions.user-pii=false",
        "iterable.permissions.enable-writes=false",
        "iterable.permissions.enable-sends=false"
})
@AutoConfigureMockMvc
class McpEndpointIntegrationTest {

    private static final String LIST_TOOLS = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void mcpWithoutKeyIsUnauthorized() throws Exception {
        mockMvc.perform(post("/mcp").contentType(MediaType.APPLICATION_JSON).content(LIST_TOOLS))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("API key required"));
    }

    @Test
    void toolsListHidesPiiToolsByDefault() throws Exception {
        mockMvc.perform(post("/mcp").param("api_key", "test-key")
                        .contentType(MediaType.APPLICATION_JSON).content(LIST_TOOLS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jsonrpc").value("2.0"))
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.result.tools[*].name").value(hasItem("get_campaigns")))
                .andExpect(jsonPath("$.result.tools[*].name").value(not(hasItem("get_user_by_email"))));
    }

    @Test
    void deniedToolCallIsUnknownTool() throws Exception {
        String call = "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"get_user_by_email\",\"arguments\":{\"email\":\"a@x.com\"}}}";

        mockMvc.perform(post("/mcp").header("X-Iterable-Api-Key", "test-key")
                        .contentType(MediaType.APPLICATION_JSON).content(call))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error.code").value(-32602))
                .andExpect(jsonPath("$.error.message").value("Unknown tool: get_user_by_email"));
    }

    @Test
    void notificationIsAccepted() throws Exception {
        mockMvc.perform(post("/mcp").param("api_key", "test-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"))
                .andExpect(status().isAccepted());
    }

    @Test
    void malformedJsonIsParseError() throws Exception {
        mockMvc.perform(post("/mcp").param("api_key", "test-key")
                        .contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value(-32700));
    }

    @Test
    void infoRouteIsPublic() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Iterable MCP Server"));
    }

    @Test
    void pathParameterDoesNotSkipTheKeyCheck() throws Exception {
        mockMvc.perform(post("/mcp;x=1").contentType(MediaType.APPLICATION_JSON).content(LIST_TOOLS))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void credentialReachesToolCall() throws Exception {
        String call = "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"get_campaign\",\"arguments\":{}}}";

        mockMvc.perform(post("/mcp").param("api_key", "test-key")
                        .contentType(MediaType.APPLICATION_JSON).content(call))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.isError").value(true))
                .andExpect(jsonPath("$.result.content[0].text").value("'id' is required"));
    }
}
