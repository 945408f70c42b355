package com.mailroom.message;

import java.util.List;

/** Messages drained by {@code GET /messages/new/{recipient}}; all are now read. */
public record UnreadMessages(
        List<MessageResponse> messages,
        int total,
        String recipient
) {}
