package com.mailroom.error;

import java.util.UUID;

public class MessageNotFoundException extends MessageServiceException {

    public MessageNotFoundException(UUID id) {
        super("Message " + id + " not found");
    }
}
