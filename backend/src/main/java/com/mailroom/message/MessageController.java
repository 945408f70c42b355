package com.mailroom.message;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/messages")
public class MessageController {

    private final MessageService messageService;

    public MessageController(MessageService messageService) {
        this.messageService = messageService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<MessageResponse> sendMessage(@RequestBody MessageRequest request) {
        return messageService.sendMessage(request);
    }

    @GetMapping
    public Mono<MessagesPage> getAll(
            @RequestParam(required = false) Integer start,
            @RequestParam(required = false) Integer limit) {
        return messageService.getMessages(start, limit);
    }

    /**
     * Unread messages for the recipient. They are marked read by this call.
     */
    @GetMapping("/new/{recipient}")
    public Mono<UnreadMessages> getNew(@PathVariable String recipient) {
        return messageService.getNewMessages(recipient);
    }

    @GetMapping("/by-id/{messageId}")
    public Mono<MessageResponse> getMessage(@PathVariable UUID messageId) {
        return messageService.getMessageById(messageId);
    }

    @GetMapping("/{recipient}")
    public Mono<MessagesPage> getInbox(
            @PathVariable String recipient,
            @RequestParam(required = false) Integer start,
            @RequestParam(required = false) Integer limit) {
        return messageService.getMessages(recipient, start, limit);
    }

    @DeleteMapping("/{messageId}")
    public Mono<DeleteResponse> deleteMessage(@PathVariable UUID messageId) {
        return messageService.deleteMessage(messageId);
    }

    @DeleteMapping
    public Mono<DeleteResponse> deleteMessages(
            @RequestParam(name = "message_ids", required = false) List<UUID> messageIds) {
        return messageService.deleteMessages(messageIds);
    }
}
