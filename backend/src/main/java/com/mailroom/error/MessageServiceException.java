package com.mailroom.error;

/**
 * Base type for every failure the message service reports on purpose.
 */
public class MessageServiceException extends RuntimeException {

    public MessageServiceException(String message) {
        super(message);
    }

    public MessageServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
