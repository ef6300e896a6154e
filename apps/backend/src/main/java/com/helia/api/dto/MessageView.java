package com.helia.api.dto;

import com.helia.domain.ChatMessage;
import com.helia.domain.MessageRole;
import com.helia.domain.MessageState;

import java.time.Instant;

/** One history entry; {@code partial} tells clients the reply was cut short. */
public record MessageView(
        String id,
        long sequence,
        MessageRole role,
        String content,
        MessageState state,
        String imageUrl,
        Instant createdAt
) {
    public static MessageView of(ChatMessage message) {
        return new MessageView(message.id(), message.sequence(), message.role(), message.content(),
                message.state(), message.imageUrl(), message.createdAt());
    }
}
