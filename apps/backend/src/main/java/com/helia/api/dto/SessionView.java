package com.helia.api.dto;

import com.helia.domain.Session;

import java.time.Instant;

public record SessionView(String id, String title, String personaId, Instant createdAt, Instant updatedAt) {

    public static SessionView of(Session session) {
        return new SessionView(session.id(), session.title(), session.personaId(),
                session.createdAt(), session.updatedAt());
    }
}
