package com.mailroom.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.mailroom.storage.InMemoryMessageStore;
import com.mailroom.storage.MessageStore;

/**
 * Creates the one store instance of the process. Everything else receives it by
 * constructor injection.
 */
@Configuration
public class StorageConfig {

    @Bean
    public MessageStore messageStore() {
        return new InMemoryMessageStore();
    }
}
