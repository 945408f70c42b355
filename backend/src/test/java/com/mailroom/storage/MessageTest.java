package com.mailroom.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.mailroom.error.ValidationException;

class MessageTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private Message build(String recipient, String content) {
        return new Message(UUID.randomUUID(), recipient, "alice", content, NOW, MessageStatus.UNREAD);
    }

    @Test
    void emptyRecipient_shouldBeRejected() {
        assertThrows(ValidationException.class, () -> build("", "hi"));
        assertThrows(ValidationException.class, () -> build("   ", "hi"));
        assertThrows(ValidationException.class, () -> build(null, "hi"));
    }

    @Test
    void emptyContent_shouldBeRejected() {
        ValidationException ex = assertThrows(ValidationException.class, () -> build("bob", ""));
        assertTrue(ex.getMessage().contains("content"));
        assertThrows(ValidationException.class, () -> build("bob", null));
    }

    @Test
    void missingSender_isAllowed() {
        Message message = new Message(UUID.randomUUID(), "bob", null, "hi", NOW, MessageStatus.UNREAD);
        assertEquals(null, message.sender());
        assertTrue(message.isUnread());
    }

    @Test
    void markedRead_shouldKeepIdentityAndOnlyChangeStatus() {
        Message unread = build("bob", "hi");
        Message read = unread.markedRead();

        assertEquals(MessageStatus.READ, read.status());
        assertEquals(MessageStatus.UNREAD, unread.status());
        assertEquals(unread.id(), read.id());
        assertEquals(unread.recipient(), read.recipient());
        assertEquals(unread.timestamp(), read.timestamp());
        assertEquals(unread.content(), read.content());
        assertSame(read, read.markedRead());
    }
}
