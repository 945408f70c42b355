package com.mailroom.storage;

import java.util.List;

/**
 * A slice of an ordered result set plus the size of the whole set at call time.
 */
public record MessagePage(List<Message> messages, int total) {

    public MessagePage {
        messages = List.copyOf(messages);
    }

    public static MessagePage empty() {
        return new MessagePage(List.of(), 0);
    }
}
