package com.helia.service;

import com.helia.config.ChatProperties;
import com.helia.domain.ChatMessage;
import com.helia.domain.PersonaConfig;
import com.helia.domain.Session;
import com.helia.error.ChatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Session CRUD on top of the {@link ConversationStore}. The persona is checked once, at creation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionManager {

    private static final String ELLIPSIS = "...";

    private final ConversationStore store;
    private final PersonaRegistry personaRegistry;
    private final ChatProperties properties;

    public Session create(String ownerId, String personaId, String title) {
        PersonaConfig persona = personaRegistry.resolve(personaId);
        Session session = store.createSession(ownerId, persona.personaId(), normalizeTitle(title));
        log.info("Session created ownerId={} sessionId={} personaId={}", ownerId, session.id(), persona.personaId());
        return session;
    }

    public List<Session> list(String ownerId) {
        return store.listSessions(ownerId, properties.getSessionListLimit());
    }

    public Session get(String ownerId, String sessionId) {
        return store.findSession(ownerId, sessionId);
    }

    public Session rename(String ownerId, String sessionId, String title) {
        if (!StringUtils.hasText(title)) {
            throw ChatException.invalidInput("title must not be blank");
        }
        return store.renameSession(ownerId, sessionId, normalizeTitle(title));
    }

    public void delete(String ownerId, String sessionId) {
        store.deleteSession(ownerId, sessionId);
        log.info("Session deleted ownerId={} sessionId={}", ownerId, sessionId);
    }

    public List<ChatMessage> history(String ownerId, String sessionId) {
        return store.listMessages(ownerId, sessionId);
    }

    /** Blank becomes the default title; long titles keep their head plus an ellipsis. */
    public String normalizeTitle(String title) {
        if (!StringUtils.hasText(title)) {
            return properties.getDefaultTitle();
        }
        String trimmed = title.strip();
        int max = properties.getTitleMaxLength();
        return trimmed.length() > max ? trimmed.substring(0, max) + ELLIPSIS : trimmed;
    }
}
