package com.mailroom.health;

import java.time.Instant;

public record HealthResponse(String service, String status, Instant timestamp) {}
