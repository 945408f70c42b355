package com.mailroom.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Service settings under the {@code mailroom.*} prefix.
 *
 * Pagination limits above {@code maxLimit} and bulk deletes above {@code maxIds}
 * are rejected, never clamped.
 */
@ConfigurationProperties(prefix = "mailroom")
public record MailroomProperties(
        @DefaultValue("Mailroom Message API") String serviceName,
        @DefaultValue Pagination pagination,
        @DefaultValue Delete delete
) {

    public record Pagination(
            @DefaultValue("10") int defaultLimit,
            @DefaultValue("500") int maxLimit,
            @DefaultValue("100") int recipientMaxLimit
    ) {}

    public record Delete(
            @DefaultValue("100") int maxIds
    ) {}
}
