package com.helia.domain;

import java.time.Instant;

/** Append-only history entry; {@code sequence} is 1-based and gapless within a session. */
public record ChatMessage(
        String id,
        String sessionId,
        long sequence,
        MessageRole role,
        String content,
        MessageState state,
        String imageUrl,
        Instant createdAt
) { }
