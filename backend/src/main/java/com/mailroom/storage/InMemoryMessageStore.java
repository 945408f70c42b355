package com.mailroom.storage;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mailroom.error.MessageNotFoundException;
import com.mailroom.error.RecipientNotFoundException;
import com.mailroom.error.StorageException;
import com.mailroom.error.ValidationException;

/**
 * Process-memory {@link MessageStore}.
 *
 * <p>One read/write lock guards both the message map and the recipient index.
 * Queries take the read lock, every mutation (including the read-state drain in
 * {@link #fetchUnread}) takes the write lock. Nothing inside a critical section
 * performs I/O.
 */
public class InMemoryMessageStore implements MessageStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Insertion ordered. Replacing a value on the read transition keeps its position.
    private final Map<UUID, Message> messages = new LinkedHashMap<>();

    // recipient -> ids in insertion order; a recipient is dropped with its last message
    private final Map<String, Set<UUID>> recipientIndex = new LinkedHashMap<>();

    private final Supplier<UUID> idGenerator;
    private final Clock clock;

    public InMemoryMessageStore() {
        this(UUID::randomUUID, Clock.systemUTC());
    }

    InMemoryMessageStore(Supplier<UUID> idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Override
    public Message create(String recipient, String content, String sender) {
        lock.writeLock().lock();
        try {
            UUID id = idGenerator.get();
            if (id == null) {
                throw new StorageException("Id generator produced no id");
            }
            if (messages.containsKey(id)) {
                throw new StorageException("Id generator produced a duplicate id: " + id);
            }
            Message message = new Message(id, recipient, sender, content,
                    clock.instant(), MessageStatus.UNREAD);
            messages.put(id, message);
            recipientIndex.computeIfAbsent(recipient, r -> new LinkedHashSet<>()).add(id);
            log.debug("Created message {} for recipient {}", id, recipient);
            return message;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Message get(UUID id) {
        lock.readLock().lock();
        try {
            Message message = messages.get(id);
            if (message == null) {
                throw new MessageNotFoundException(id);
            }
            return message;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public MessagePage listAll(int start, int limit) {
        checkPageBounds(start, limit);
        lock.readLock().lock();
        try {
            return page(messages.values(), start, limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public MessagePage listByRecipient(String recipient, int start, int limit) {
        checkPageBounds(start, limit);
        lock.readLock().lock();
        try {
            Set<UUID> ids = recipientIndex.get(recipient);
            if (ids == null) {
                return MessagePage.empty();
            }
            List<Message> owned = new ArrayList<>(ids.size());
            for (UUID id : ids) {
                owned.add(messages.get(id));
            }
            return page(owned, start, limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public MessagePage fetchUnread(String recipient) {
        lock.writeLock().lock();
        try {
            Set<UUID> ids = recipientIndex.get(recipient);
            if (ids == null) {
                throw new RecipientNotFoundException(recipient);
            }
            List<Message> drained = new ArrayList<>();
            for (UUID id : ids) {
                Message message = messages.get(id);
                if (message.isUnread()) {
                    Message read = message.markedRead();
                    messages.put(id, read);
                    drained.add(read);
                }
            }
            log.debug("Marked {} messages read for recipient {}", drained.size(), recipient);
            return new MessagePage(drained, drained.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean deleteOne(UUID id) {
        lock.writeLock().lock();
        try {
            boolean deleted = remove(id);
            log.debug("Delete of message {}: {}", id, deleted ? "removed" : "not present");
            return deleted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public DeletionResult deleteMany(Collection<UUID> ids) {
        lock.writeLock().lock();
        try {
            List<UUID> deleted = new ArrayList<>();
            for (UUID id : ids) {
                if (id != null && remove(id)) {
                    deleted.add(id);
                }
            }
            log.debug("Deleted {} out of {} requested messages", deleted.size(), ids.size());
            return new DeletionResult(deleted.size(), deleted);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Set<String> listRecipients() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(recipientIndex.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public StoreStatistics stats() {
        lock.readLock().lock();
        try {
            int read = 0;
            for (Message message : messages.values()) {
                if (!message.isUnread()) {
                    read++;
                }
            }
            Map<String, Integer> perRecipient = new LinkedHashMap<>();
            recipientIndex.forEach((recipient, ids) -> perRecipient.put(recipient, ids.size()));
            int total = messages.size();
            return new StoreStatistics(recipientIndex.size(), total, read, total - read, perRecipient);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            messages.clear();
            recipientIndex.clear();
            log.info("Cleared all stored messages");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Caller holds the write lock. */
    private boolean remove(UUID id) {
        Message removed = messages.remove(id);
        if (removed == null) {
            return false;
        }
        Set<UUID> ids = recipientIndex.get(removed.recipient());
        ids.remove(id);
        if (ids.isEmpty()) {
            recipientIndex.remove(removed.recipient());
        }
        return true;
    }

    private static MessagePage page(Collection<Message> ordered, int start, int limit) {
        int total = ordered.size();
        if (start >= total) {
            return new MessagePage(List.of(), total);
        }
        List<Message> slice = ordered.stream()
                .skip(start)
                .limit(limit)
                .toList();
        return new MessagePage(slice, total);
    }

    private static void checkPageBounds(int start, int limit) {
        if (start < 0) {
            throw new ValidationException("start must not be negative, got " + start);
        }
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1, got " + limit);
        }
    }
}
