package com.mailroom.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts taken from one consistent snapshot of the store.
 * {@code readCount + unreadCount == totalMessages} always holds.
 */
public record StoreStatistics(
        int recipientCount,
        int totalMessages,
        int readCount,
        int unreadCount,
        Map<String, Integer> perRecipientCounts
) {

    public StoreStatistics {
        perRecipientCounts = Collections.unmodifiableMap(new LinkedHashMap<>(perRecipientCounts));
    }
}
