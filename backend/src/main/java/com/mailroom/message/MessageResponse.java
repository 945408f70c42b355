package com.mailroom.message;

import java.time.Instant;

import com.mailroom.storage.Message;
import com.mailroom.storage.MessageStatus;

public record MessageResponse(
        String id,
        String recipient,
        String content,
        String sender,
        Instant timestamp,
        MessageStatus status
) {

    public static MessageResponse from(Message message) {
        return new MessageResponse(
                message.id().toString(),
                message.recipient(),
                message.content(),
                message.sender(),
                message.timestamp(),
                message.status()
        );
    }
}
