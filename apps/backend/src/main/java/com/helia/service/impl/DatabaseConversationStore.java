package com.helia.service.impl;

import com.helia.domain.ChatMessage;
import com.helia.domain.MessageRole;
import com.helia.domain.MessageState;
import com.helia.domain.PersonaConfig;
import com.helia.domain.Session;
import com.helia.error.ChatException;
import com.helia.mapper.ChatMessageMapper;
import com.helia.mapper.ChatSessionMapper;
import com.helia.service.ConversationStore;
import com.helia.service.PersonaRegistry;
import com.helia.service.impl.entity.ChatMessageEntity;
import com.helia.service.impl.entity.ChatSessionEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * MyBatis-backed store. Sequence numbers come from a counter column on the session row that is
 * incremented in the same transaction as the message insert, so the row lock orders concurrent
 * appends even across processes. Deleting a session removes its messages in the same transaction.
 */
@Service
@ConditionalOnProperty(name = "helia.chat.store", havingValue = "database")
@RequiredArgsConstructor
@Slf4j
public class DatabaseConversationStore implements ConversationStore {

    private final ChatSessionMapper sessionMapper;
    private final ChatMessageMapper messageMapper;
    private final PersonaRegistry personaRegistry;
    private final SessionLocks locks;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Transactional
    @Override
    public Session createSession(String ownerId, String personaId, String title) {
        PersonaConfig persona = personaRegistry.resolve(personaId);
        Instant now = clock.instant();
        Session session = new Session(UUID.randomUUID().toString(), ownerId, title, persona.personaId(), now, now);
        guard("createSession", () -> sessionMapper.insert(ChatSessionEntity.from(session)));
        log.debug("Database session created ownerId={} sessionId={} personaId={}", ownerId, session.id(), personaId);
        return session;
    }

    @Override
    public List<Session> listSessions(String ownerId, int limit) {
        List<ChatSessionEntity> rows = guard("listSessions", () -> sessionMapper.selectByOwner(ownerId, Math.max(0, limit)));
        return rows.stream().map(ChatSessionEntity::toSession).toList();
    }

    @Override
    public Session findSession(String ownerId, String sessionId) {
        ChatSessionEntity row = guard("findSession", () -> sessionMapper.selectOwned(sessionId, ownerId));
        if (row == null) {
            throw ChatException.notFound();
        }
        return row.toSession();
    }

    @Transactional
    @Override
    public Session renameSession(String ownerId, String sessionId, String title) {
        int updated = guard("renameSession", () -> sessionMapper.updateTitle(sessionId, ownerId, title));
        if (updated == 0) {
            throw ChatException.notFound();
        }
        return findSession(ownerId, sessionId);
    }

    @Transactional
    @Override
    public void deleteSession(String ownerId, String sessionId) {
        ChatSessionEntity row = guard("deleteSession", () -> sessionMapper.selectOwnedForUpdate(sessionId, ownerId));
        if (row == null) {
            throw ChatException.notFound();
        }
        int messages = guard("deleteSession", () -> messageMapper.deleteBySession(sessionId));
        guard("deleteSession", () -> sessionMapper.deleteById(sessionId));
        log.debug("Database session deleted ownerId={} sessionId={} removedMessages={}", ownerId, sessionId, messages);
    }

    @Override
    public ChatMessage appendMessage(String sessionId, MessageRole role, String content,
                                     MessageState state, String imageUrl) {
        if (sessionId == null || sessionId.isBlank()) {
            throw ChatException.notFound();
        }
        // commit happens inside the lock so the next writer in this JVM sees the new counter
        return locks.withLock(sessionId, () -> guard("appendMessage",
                () -> transactionTemplate.execute(status -> insertNext(sessionId, role, content, state, imageUrl))));
    }

    @Transactional(readOnly = true)
    @Override
    public List<ChatMessage> listMessages(String ownerId, String sessionId) {
        List<ChatMessageEntity> rows = guard("listMessages", () -> messageMapper.selectOwnedHistory(sessionId, ownerId));
        if (rows.isEmpty() && guard("listMessages", () -> sessionMapper.selectOwned(sessionId, ownerId)) == null) {
            throw ChatException.notFound();
        }
        return rows.stream().map(ChatMessageEntity::toMessage).toList();
    }

    @Override
    public List<ChatMessage> recentMessages(String sessionId, int limit) {
        List<ChatMessageEntity> rows = new ArrayList<>(
                guard("recentMessages", () -> messageMapper.selectLatest(sessionId, Math.max(0, limit))));
        if (rows.isEmpty() && guard("recentMessages", () -> sessionMapper.countById(sessionId)) == 0) {
            throw ChatException.notFound();
        }
        Collections.reverse(rows);
        return rows.stream().map(ChatMessageEntity::toMessage).toList();
    }

    private ChatMessage insertNext(String sessionId, MessageRole role, String content,
                                   MessageState state, String imageUrl) {
        Instant now = clock.instant();
        if (sessionMapper.advanceSequence(sessionId, now) == 0) {
            throw ChatException.notFound();
        }
        Long sequence = sessionMapper.selectLastSequence(sessionId);
        ChatMessage message = new ChatMessage(UUID.randomUUID().toString(), sessionId, sequence,
                role, content, state, imageUrl, now);
        messageMapper.insert(ChatMessageEntity.from(message));
        return message;
    }

    private <T> T guard(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Conversation storage failure operation={} err={}", operation, ex.toString());
            throw ChatException.storage(operation, ex);
        }
    }
}
