package com.mailroom.error;

public class RecipientNotFoundException extends MessageServiceException {

    public RecipientNotFoundException(String recipient) {
        super("No messages found for recipient " + recipient);
    }
}
