package com.helia.service.impl.entity;

import com.helia.domain.ChatMessage;
import com.helia.domain.MessageRole;
import com.helia.domain.MessageState;
import lombok.Data;

import java.time.Instant;

@Data
public class ChatMessageEntity {

    private String id;
    private String sessionId;
    private Long sequenceNo;
    private String role;
    private String content;
    private String state;
    private String imageUrl;
    private Instant createdAt;

    public ChatMessage toMessage() {
        return new ChatMessage(id, sessionId, sequenceNo, MessageRole.fromWire(role), content,
                MessageState.valueOf(state), imageUrl, createdAt);
    }

    public static ChatMessageEntity from(ChatMessage message) {
        ChatMessageEntity entity = new ChatMessageEntity();
        entity.setId(message.id());
        entity.setSessionId(message.sessionId());
        entity.setSequenceNo(message.sequence());
        entity.setRole(message.role().wire());
        entity.setContent(message.content());
        entity.setState(message.state().name());
        entity.setImageUrl(message.imageUrl());
        entity.setCreatedAt(message.createdAt());
        return entity;
    }
}
