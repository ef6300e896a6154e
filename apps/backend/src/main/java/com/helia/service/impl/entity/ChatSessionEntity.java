package com.helia.service.impl.entity;

import com.helia.domain.Session;
import lombok.Data;

import java.time.Instant;

@Data
public class ChatSessionEntity {

    private String id;
    private String ownerId;
    private String title;
    private String personaId;
    private Long lastSequence;
    private Instant createdAt;
    private Instant updatedAt;

    public Session toSession() {
        return new Session(id, ownerId, title, personaId, createdAt, updatedAt);
    }

    public static ChatSessionEntity from(Session session) {
        ChatSessionEntity entity = new ChatSessionEntity();
        entity.setId(session.id());
        entity.setOwnerId(session.ownerId());
        entity.setTitle(session.title());
        entity.setPersonaId(session.personaId());
        entity.setLastSequence(0L);
        entity.setCreatedAt(session.createdAt());
        entity.setUpdatedAt(session.updatedAt());
        return entity;
    }
}
