package com.helia.service.impl;

import com.helia.domain.ChatMessage;
import com.helia.domain.MessageRole;
import com.helia.domain.MessageState;
import com.helia.domain.PersonaConfig;
import com.helia.domain.Session;
import com.helia.error.ChatException;
import com.helia.service.ConversationStore;
import com.helia.service.PersonaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
@ConditionalOnProperty(name = "helia.chat.store", havingValue = "in-memory", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InMemoryConversationStore implements ConversationStore {

    private static final Comparator<Session> MOST_RECENT_FIRST =
            Comparator.comparing(Session::updatedAt).reversed()
                    .thenComparing(Comparator.comparing(Session::createdAt).reversed());

    private final PersonaRegistry personaRegistry;
    private final SessionLocks locks;
    private final Clock clock;

    /** sessionId -> session with its messages; a bucket is only mutated under its session lock */
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    private static final class Bucket {
        volatile Session session;
        final List<ChatMessage> messages = new ArrayList<>();

        Bucket(Session session) {
            this.session = session;
        }
    }

    @Override
    public Session createSession(String ownerId, String personaId, String title) {
        PersonaConfig persona = personaRegistry.resolve(personaId);
        Instant now = clock.instant();
        Session session = new Session(UUID.randomUUID().toString(), ownerId, title, persona.personaId(), now, now);
        buckets.put(session.id(), new Bucket(session));
        log.debug("Created session ownerId={} sessionId={} personaId={}", ownerId, session.id(), personaId);
        return session;
    }

    @Override
    public List<Session> listSessions(String ownerId, int limit) {
        return buckets.values().stream()
                .map(bucket -> bucket.session)
                .filter(session -> session.isOwnedBy(ownerId))
                .sorted(MOST_RECENT_FIRST)
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public Session findSession(String ownerId, String sessionId) {
        return owned(ownerId, sessionId).session;
    }

    @Override
    public Session renameSession(String ownerId, String sessionId, String title) {
        return locks.withLock(key(sessionId), () -> {
            Bucket bucket = owned(ownerId, sessionId);
            bucket.session = bucket.session.withTitle(title);
            return bucket.session;
        });
    }

    @Override
    public void deleteSession(String ownerId, String sessionId) {
        locks.runLocked(key(sessionId), () -> {
            Bucket bucket = owned(ownerId, sessionId);
            buckets.remove(sessionId);
            int removed = bucket.messages.size();
            bucket.messages.clear();
            log.debug("Deleted session ownerId={} sessionId={} removedMessages={}", ownerId, sessionId, removed);
        });
    }

    @Override
    public ChatMessage appendMessage(String sessionId, MessageRole role, String content,
                                     MessageState state, String imageUrl) {
        return locks.withLock(key(sessionId), () -> {
            Bucket bucket = buckets.get(sessionId);
            if (bucket == null) {
                throw ChatException.notFound();
            }
            Instant now = clock.instant();
            ChatMessage message = new ChatMessage(UUID.randomUUID().toString(), sessionId,
                    bucket.messages.size() + 1L, role, content, state, imageUrl, now);
            bucket.messages.add(message);
            bucket.session = bucket.session.touchedAt(now);
            return message;
        });
    }

    @Override
    public List<ChatMessage> listMessages(String ownerId, String sessionId) {
        return locks.withLock(key(sessionId), () -> List.copyOf(owned(ownerId, sessionId).messages));
    }

    @Override
    public List<ChatMessage> recentMessages(String sessionId, int limit) {
        return locks.withLock(key(sessionId), () -> {
            Bucket bucket = buckets.get(sessionId);
            if (bucket == null) {
                throw ChatException.notFound();
            }
            int size = bucket.messages.size();
            int from = Math.max(0, size - Math.max(0, limit));
            return List.copyOf(bucket.messages.subList(from, size));
        });
    }

    private Bucket owned(String ownerId, String sessionId) {
        Bucket bucket = sessionId == null ? null : buckets.get(sessionId);
        if (bucket == null || !bucket.session.isOwnedBy(ownerId)) {
            throw ChatException.notFound();
        }
        return bucket;
    }

    private static String key(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw ChatException.notFound();
        }
        return sessionId;
    }
}
