package com.mailroom.message;

/**
 * Body of {@code POST /messages}. Fields are trimmed by the service before use.
 */
public record MessageRequest(
        String recipient,   // email, username, phone: any free-form address
        String content,
        String sender       // optional
) {}
