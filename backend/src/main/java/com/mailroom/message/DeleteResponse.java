package com.mailroom.message;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteResponse(
        @JsonProperty("deleted_count") int deletedCount,
        @JsonProperty("message_ids") List<String> messageIds,
        Instant timestamp
) {}
