package com.mailroom.error;

import java.time.Instant;

public record ErrorResponse(String detail, Instant timestamp) {

    public static ErrorResponse of(String detail) {
        return new ErrorResponse(detail, Instant.now());
    }
}
