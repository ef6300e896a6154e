package com.helia.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of the chat engine and conversation store.
 *
 * <p>{@code store} picks the {@link com.helia.service.ConversationStore} implementation:
 * {@code in-memory} (default) or {@code database}.</p>
 */
@Data
@ConfigurationProperties(prefix = "helia.chat")
public class ChatProperties {

    private String store = "in-memory";

    /** Number of trailing messages sent to the model after the system prompt. */
    private int contextWindow = 20;

    /** Upper bound on the whole provider stream of one turn. */
    private Duration turnTimeout = Duration.ofSeconds(120);

    private int sessionListLimit = 20;

    private int titleMaxLength = 35;

    private String defaultTitle = "New Chat";

    private int maxMessageLength = 8000;
}
