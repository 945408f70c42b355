package com.mailroom.storage;

import java.util.Collection;
import java.util.Set;
import java.util.UUID;

/**
 * Storage capability for messages.
 * Callers depend on this interface only, so a persistent variant can replace the
 * in-memory one without touching them.
 *
 * <p>Every operation is atomic with respect to every other: no caller ever
 * observes the collection half way through a mutation. Ordering is always
 * insertion order.
 */
public interface MessageStore {

    /**
     * Stores a new unread message and returns it.
     *
     * @throws com.mailroom.error.ValidationException if recipient or content is empty
     * @throws com.mailroom.error.StorageException on an id collision; nothing is stored
     */
    Message create(String recipient, String content, String sender);

    /**
     * Looks up a single message.
     *
     * @throws com.mailroom.error.MessageNotFoundException if no message has this id
     */
    Message get(UUID id);

    /**
     * Page over all messages regardless of recipient. Status is not touched.
     * A {@code start} past the end yields an empty page with the correct total.
     *
     * @throws com.mailroom.error.ValidationException if {@code start < 0} or {@code limit < 1}
     */
    MessagePage listAll(int start, int limit);

    /**
     * Same contract as {@link #listAll} restricted to one recipient.
     * An unknown recipient yields an empty page with total 0.
     */
    MessagePage listByRecipient(String recipient, int start, int limit);

    /**
     * Drains the recipient's unread messages: selects them, marks them read and
     * returns them (already read) in one critical section. A message is returned
     * by at most one call.
     *
     * @throws com.mailroom.error.RecipientNotFoundException if the recipient holds
     *         no messages at all; a known recipient with nothing unread gets an empty page
     */
    MessagePage fetchUnread(String recipient);

    /** Removes a message. Returns whether it existed. */
    boolean deleteOne(UUID id);

    /**
     * Removes every listed message that exists. Missing ids are skipped.
     * Deleted ids are reported in input order.
     */
    DeletionResult deleteMany(Collection<UUID> ids);

    /** Recipients that currently hold at least one message, in first-seen order. */
    Set<String> listRecipients();

    /** Aggregate counts from one consistent snapshot. */
    StoreStatistics stats();

    /** Drops every message. */
    void clear();
}
