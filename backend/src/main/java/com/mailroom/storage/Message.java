package com.mailroom.storage;

import java.time.Instant;
import java.util.UUID;

import com.mailroom.error.ValidationException;

/**
 * A stored message.
 *
 * <p>Immutable: the store owns the canonical copy and replaces it with
 * {@link #markedRead()} on the read transition, so a value handed to a caller
 * can never change store state.
 *
 * <p>Ordering is the store's insertion order, never {@code timestamp}: two
 * messages may share a timestamp.
 */
public record Message(
        UUID id,
        String recipient,
        String sender,        // null when the client did not name one
        String content,
        Instant timestamp,
        MessageStatus status
) {

    public Message {
        if (id == null) {
            throw new ValidationException("Message id is required");
        }
        if (recipient == null || recipient.isBlank()) {
            throw new ValidationException("Recipient cannot be empty");
        }
        if (content == null || content.isBlank()) {
            throw new ValidationException("Message content cannot be empty");
        }
        if (timestamp == null || status == null) {
            throw new ValidationException("Message timestamp and status are required");
        }
    }

    public boolean isUnread() {
        return status == MessageStatus.UNREAD;
    }

    /** Returns this message with status {@link MessageStatus#READ}. */
    public Message markedRead() {
        if (status == MessageStatus.READ) {
            return this;
        }
        return new Message(id, recipient, sender, content, timestamp, MessageStatus.READ);
    }
}
