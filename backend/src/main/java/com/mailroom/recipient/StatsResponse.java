package com.mailroom.recipient;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import com.mailroom.storage.StoreStatistics;

public record StatsResponse(
        @JsonProperty("total_messages") int totalMessages,
        @JsonProperty("total_recipients") int totalRecipients,
        @JsonProperty("total_read") int totalRead,
        @JsonProperty("total_unread") int totalUnread,
        @JsonProperty("messages_per_recipient") Map<String, Integer> messagesPerRecipient,
        Instant timestamp
) {

    public static StatsResponse from(StoreStatistics stats, Instant takenAt) {
        return new StatsResponse(
                stats.totalMessages(),
                stats.recipientCount(),
                stats.readCount(),
                stats.unreadCount(),
                stats.perRecipientCounts(),
                takenAt
        );
    }
}
