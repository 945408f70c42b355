package com.mailroom.storage;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a bulk delete: only the ids that actually existed are reported.
 */
public record DeletionResult(int deletedCount, List<UUID> deletedIds) {

    public DeletionResult {
        deletedIds = List.copyOf(deletedIds);
    }
}
