package com.mailroom.error;

/**
 * A storage invariant would have been broken (e.g. an id collision).
 * The operation was rejected as a whole; the store is unchanged.
 */
public class StorageException extends MessageServiceException {

    public StorageException(String message) {
        super(message);
    }
}
