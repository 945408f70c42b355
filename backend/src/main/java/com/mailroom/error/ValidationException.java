package com.mailroom.error;

/** Invalid input to a message operation. Nothing has been changed when this is thrown. */
public class ValidationException extends MessageServiceException {

    public ValidationException(String message) {
        super(message);
    }
}
