package io.github.drompincen.iterablemcp.tools;

import io.github.drompincen.iterablemcp.protocol.api.Credential;
import io.github.drompincen.iterablemcp.runtime.client.SentMessagesQuery;
import com.fasterxml.jackson.databind.JsonNode;

public class GetSentMessagesTool extends IterableTool {

    @Override public String name() { return "get_sent_messages"; }
    @Override public String description() { return "Get messages sent to a specific user"; }

    @Override
    protected JsonNode buildSchema() {
        return InputSchema.object()
                .email("email", "User's email")
                .string("userId", "User's ID")
                .boundedInteger("limit", "Max number of messages to return", 1, null)
                .integerArray("campaignIds", "Filter by campaign IDs")
                .string("startDateTime", null)
                .string("endDateTime", null)
                .string("messageMedium", "Filter by message type (Email, SMS, etc.)")
                .build();
    }

    @Override
    protected JsonNode invoke(Credential credential, JsonNode input) {
        return client.getSentMessages(credential, new SentMessagesQuery(
                optString(input, "email"),
                optString(input, "userId"),
                optInt(input, "limit"),
                optLongList(input, "campaignIds"),
                optString(input, "startDateTime"),
                optString(input, "endDateTime"),
                optString(input, "messageMedium")));
    }
}
