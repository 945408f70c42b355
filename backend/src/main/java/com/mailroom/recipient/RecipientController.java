package com.mailroom.recipient;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.mailroom.message.MessageService;

import reactor.core.publisher.Mono;

@RestController
public class RecipientController {

    private final MessageService messageService;

    public RecipientController(MessageService messageService) {
        this.messageService = messageService;
    }

    @GetMapping("/recipients")
    public Mono<List<String>> listRecipients() {
        return messageService.getRecipients();
    }

    /** Counts taken from one consistent snapshot of the store. */
    @GetMapping("/stats")
    public Mono<StatsResponse> getStatistics() {
        return messageService.getStatistics();
    }
}
