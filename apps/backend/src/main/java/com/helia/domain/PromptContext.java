package com.helia.domain;

import java.util.List;

/**
 * Ordered model input for one turn: the persona system prompt first, then the windowed history.
 */
public record PromptContext(String sessionId, PersonaConfig persona, List<Entry> messages) {

    public enum Kind {
        SYSTEM, USER, ASSISTANT
    }

    public record Entry(Kind kind, String content) {

        public static Entry of(ChatMessage message) {
            Kind kind = message.role() == MessageRole.USER ? Kind.USER : Kind.ASSISTANT;
            return new Entry(kind, message.content());
        }
    }

    public PromptContext {
        messages = List.copyOf(messages);
    }

    public String systemPrompt() {
        return messages.isEmpty() ? null : messages.get(0).content();
    }

    public List<Entry> history() {
        return messages.isEmpty() ? List.of() : messages.subList(1, messages.size());
    }
}
