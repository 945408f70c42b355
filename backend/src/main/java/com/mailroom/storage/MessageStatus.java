package com.mailroom.storage;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Read state of a message. The only legal transition is {@code UNREAD -> READ}.
 */
public enum MessageStatus {

    UNREAD("unread"),
    READ("read");

    private final String value;

    MessageStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
