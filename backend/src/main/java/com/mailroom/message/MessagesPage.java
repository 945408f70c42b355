package com.mailroom.message;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A page of messages. {@code recipient} is only present on the per-recipient listing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessagesPage(
        List<MessageResponse> messages,
        int total,
        int start,
        int limit,
        String recipient
) {}
