package com.helia.service;

import com.helia.domain.ChatMessage;
import com.helia.domain.MessageRole;
import com.helia.domain.MessageState;
import com.helia.domain.Session;

import java.util.List;

/**
 * Durable, ordered record of sessions and their messages.
 *
 * <p>Every owner-scoped operation fails with {@code NOT_FOUND} both when the session does not
 * exist and when it belongs to another user. Storage failures surface as {@code STORAGE_ERROR}.</p>
 */
public interface ConversationStore {

    /** Fails with {@code INVALID_PERSONA} when the persona is not registered. */
    Session createSession(String ownerId, String personaId, String title);

    /** Most recently updated first. */
    List<Session> listSessions(String ownerId, int limit);

    Session findSession(String ownerId, String sessionId);

    /** Changes the title only; {@code updatedAt}, persona and messages stay as they are. */
    Session renameSession(String ownerId, String sessionId, String title);

    /** Removes the session together with all of its messages in one atomic step. */
    void deleteSession(String ownerId, String sessionId);

    /**
     * Appends with the next sequence number of the session and bumps its {@code updatedAt}.
     * Appends to the same session are serialized.
     */
    ChatMessage appendMessage(String sessionId, MessageRole role, String content, MessageState state, String imageUrl);

    /** Whole history, ascending by sequence. */
    List<ChatMessage> listMessages(String ownerId, String sessionId);

    /** Last {@code limit} messages, oldest first. */
    List<ChatMessage> recentMessages(String sessionId, int limit);
}
