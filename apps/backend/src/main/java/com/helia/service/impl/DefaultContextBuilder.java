package com.helia.service.impl;

import com.helia.config.ChatProperties;
import com.helia.domain.ChatMessage;
import com.helia.domain.PersonaConfig;
import com.helia.domain.PromptContext;
import com.helia.domain.Session;
import com.helia.service.ContextBuilder;
import com.helia.service.ConversationStore;
import com.helia.service.PersonaRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded prompt window. Messages that fall out of the window are dropped, not summarised.
 */
@Slf4j
@Service
public class DefaultContextBuilder implements ContextBuilder {

    private final ConversationStore store;
    private final PersonaRegistry personaRegistry;
    private final int window;

    public DefaultContextBuilder(ConversationStore store, PersonaRegistry personaRegistry, ChatProperties properties) {
        if (properties.getContextWindow() < 1) {
            throw new IllegalArgumentException("helia.chat.context-window must be >= 1");
        }
        this.store = store;
        this.personaRegistry = personaRegistry;
        this.window = properties.getContextWindow();
    }

    @Override
    public PromptContext build(Session session) {
        PersonaConfig persona = personaRegistry.resolve(session.personaId());
        List<ChatMessage> recent = store.recentMessages(session.id(), window);

        List<PromptContext.Entry> entries = new ArrayList<>(recent.size() + 1);
        entries.add(new PromptContext.Entry(PromptContext.Kind.SYSTEM, persona.systemPrompt()));
        for (ChatMessage message : recent) {
            entries.add(PromptContext.Entry.of(message));
        }
        log.debug("Context built sessionId={} personaId={} window={} messages={}",
                session.id(), persona.personaId(), window, recent.size());
        return new PromptContext(session.id(), persona, entries);
    }
}
