package io.github.drompincen.iterablemcp.runtime.client;

import java.util.List;

/** Filters for the sent-messages lookup; {@code campaignIds} is sent as repeated keys. */
public record SentMessagesQuery(
        String email,
        String userId,
        Integer limit,
        List<Long> campaignIds,
        String startDateTime,
        String endDateTime,
        String messageMedium
) {}
