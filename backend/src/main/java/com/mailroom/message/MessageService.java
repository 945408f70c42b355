package com.mailroom.message;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.mailroom.config.MailroomProperties;
import com.mailroom.error.RecipientNotFoundException;
import com.mailroom.error.ValidationException;
import com.mailroom.recipient.StatsResponse;
import com.mailroom.storage.DeletionResult;
import com.mailroom.storage.Message;
import com.mailroom.storage.MessagePage;
import com.mailroom.storage.MessageStore;

import reactor.core.publisher.Mono;

/**
 * Business logic for the message API.
 *
 * <p>Normalizes request input, applies the configured pagination and bulk
 * delete bounds, then performs exactly one {@link MessageStore} operation per
 * call. Store operations are short and memory-only, so they run inline on the
 * subscribing thread.
 */
@Service
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    static final int MAX_ADDRESS_LENGTH = 255;
    static final int MAX_CONTENT_LENGTH = 10_000;

    private final MessageStore store;
    private final MailroomProperties properties;

    public MessageService(MessageStore store, MailroomProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public Mono<MessageResponse> sendMessage(MessageRequest request) {
        return Mono.fromCallable(() -> {
            if (request == null) {
                throw new ValidationException("Request body is required");
            }
            String recipient = required(request.recipient(), "Recipient", MAX_ADDRESS_LENGTH);
            String content = required(request.content(), "Message content", MAX_CONTENT_LENGTH);
            String sender = optional(request.sender(), "Sender", MAX_ADDRESS_LENGTH);

            Message message = store.create(recipient, content, sender);
            log.info("Message created: {} for recipient: {}", message.id(), recipient);
            return MessageResponse.from(message);
        });
    }

    public Mono<MessagesPage> getMessages(Integer start, Integer limit) {
        return Mono.fromCallable(() -> {
            int offset = startOrDefault(start);
            int size = limitOrDefault(limit, properties.pagination().maxLimit());
            MessagePage page = store.listAll(offset, size);
            log.info("Retrieved {} messages (start={}, limit={})", page.messages().size(), offset, size);
            return new MessagesPage(toResponses(page), page.total(), offset, size, null);
        });
    }

    /**
     * History for one recipient, read and unread alike. Reading here never
     * changes status.
     */
    public Mono<MessagesPage> getMessages(String recipient, Integer start, Integer limit) {
        return Mono.fromCallable(() -> {
            int offset = startOrDefault(start);
            int size = limitOrDefault(limit, properties.pagination().recipientMaxLimit());
            MessagePage page = store.listByRecipient(recipient, offset, size);
            if (page.total() == 0) {
                throw new RecipientNotFoundException(recipient);
            }
            log.info("Retrieved {} messages for recipient: {}", page.messages().size(), recipient);
            return new MessagesPage(toResponses(page), page.total(), offset, size, recipient);
        });
    }

    /**
     * Returns the recipient's unread messages and marks them read. A known
     * recipient with nothing unread gets an empty result; the store rejects an
     * unknown one.
     */
    public Mono<UnreadMessages> getNewMessages(String recipient) {
        return Mono.fromCallable(() -> {
            MessagePage drained = store.fetchUnread(recipient);
            log.info("Retrieved {} new messages for recipient: {}", drained.total(), recipient);
            return new UnreadMessages(toResponses(drained), drained.total(), recipient);
        });
    }

    public Mono<MessageResponse> getMessageById(UUID id) {
        return Mono.fromCallable(() -> MessageResponse.from(store.get(id)));
    }

    /** Idempotent: deleting a missing id reports zero deletions. */
    public Mono<DeleteResponse> deleteMessage(UUID id) {
        return Mono.fromCallable(() -> {
            boolean deleted = store.deleteOne(id);
            log.info("Delete message {}: {}", id, deleted ? "deleted" : "not found");
            List<String> ids = deleted ? List.of(id.toString()) : List.of();
            return new DeleteResponse(ids.size(), ids, Instant.now());
        });
    }

    public Mono<DeleteResponse> deleteMessages(List<UUID> ids) {
        return Mono.fromCallable(() -> {
            if (ids == null || ids.isEmpty()) {
                throw new ValidationException("No message IDs provided");
            }
            int maxIds = properties.delete().maxIds();
            if (ids.size() > maxIds) {
                throw new ValidationException("Too many message IDs (max " + maxIds + ")");
            }
            DeletionResult result = store.deleteMany(ids);
            log.info("Deleted {} messages", result.deletedCount());
            List<String> deleted = result.deletedIds().stream().map(UUID::toString).toList();
            return new DeleteResponse(result.deletedCount(), deleted, Instant.now());
        });
    }

    public Mono<List<String>> getRecipients() {
        return Mono.fromCallable(() -> new ArrayList<>(store.listRecipients()));
    }

    public Mono<StatsResponse> getStatistics() {
        return Mono.fromCallable(() -> StatsResponse.from(store.stats(), Instant.now()));
    }

    private int startOrDefault(Integer start) {
        int value = start != null ? start : 0;
        if (value < 0) {
            throw new ValidationException("start must not be negative, got " + value);
        }
        return value;
    }

    private int limitOrDefault(Integer limit, int maxLimit) {
        int value = limit != null ? limit : properties.pagination().defaultLimit();
        if (value < 1 || value > maxLimit) {
            throw new ValidationException(
                    "limit must be between 1 and " + maxLimit + ", got " + value);
        }
        return value;
    }

    private static List<MessageResponse> toResponses(MessagePage page) {
        return page.messages().stream().map(MessageResponse::from).toList();
    }

    private static String required(String value, String field, int maxLength) {
        String trimmed = value == null ? "" : value.strip();
        if (trimmed.isEmpty()) {
            throw new ValidationException(field + " cannot be empty");
        }
        return withinLength(trimmed, field, maxLength);
    }

    private static String optional(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return withinLength(value.strip(), field, maxLength);
    }

    private static String withinLength(String value, String field, int maxLength) {
        if (value.length() > maxLength) {
            throw new ValidationException(field + " must be at most " + maxLength + " characters");
        }
        return value;
    }
}
