package com.helia.domain;

import java.time.Instant;

/**
 * One conversation owned by a single user. The persona is fixed for the lifetime of the session.
 */
public record Session(
        String id,
        String ownerId,
        String title,
        String personaId,
        Instant createdAt,
        Instant updatedAt
) {

    public Session withTitle(String newTitle) {
        return new Session(id, ownerId, newTitle, personaId, createdAt, updatedAt);
    }

    public Session touchedAt(Instant instant) {
        return new Session(id, ownerId, title, personaId, createdAt, instant);
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }
}
