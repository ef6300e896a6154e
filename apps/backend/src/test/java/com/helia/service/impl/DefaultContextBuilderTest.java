package com.helia.service.impl;

import com.helia.config.ChatProperties;
import com.helia.domain.MessageRole;
import com.helia.domain.MessageState;
import com.helia.domain.PromptContext;
import com.helia.domain.Session;
import com.helia.service.PersonaRegistry;
import com.helia.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultContextBuilderTest {

    private InMemoryConversationStore store;
    private PersonaRegistry registry;
    private DefaultContextBuilder builder;

    @BeforeEach
    void setUp() {
        registry = TestFixtures.personaRegistry();
        store = new InMemoryConversationStore(registry, new SessionLocks(), new TestFixtures.TickingClock());
        builder = new DefaultContextBuilder(store, registry, TestFixtures.chatProperties());
    }

    @Test
    void systemPromptComesFirstAndHistoryIsWindowed() {
        Session session = store.createSession("alice", TestFixtures.PARENT, "Ctx");
        for (int i = 1; i <= 6; i++) {
            MessageRole role = i % 2 == 1 ? MessageRole.USER : MessageRole.ASSISTANT;
            store.appendMessage(session.id(), role, "m" + i, MessageState.FINAL, null);
        }

        PromptContext context = builder.build(session);

        assertThat(context.systemPrompt()).isEqualTo("You are a helpful parenting assistant.");
        assertThat(context.messages().get(0).kind()).isEqualTo(PromptContext.Kind.SYSTEM);
        assertThat(context.history()).extracting(PromptContext.Entry::content)
                .containsExactly("m3", "m4", "m5", "m6");
        assertThat(context.history()).extracting(PromptContext.Entry::kind)
                .containsExactly(PromptContext.Kind.USER, PromptContext.Kind.ASSISTANT,
                        PromptContext.Kind.USER, PromptContext.Kind.ASSISTANT);
    }

    @Test
    void shortHistoryIsIncludedWhole() {
        Session session = store.createSession("alice", TestFixtures.PARENT, "Ctx");
        store.appendMessage(session.id(), MessageRole.USER, "only", MessageState.FINAL, null);

        PromptContext context = builder.build(session);

        assertThat(context.messages()).hasSize(2);
        assertThat(context.persona().personaId()).isEqualTo(TestFixtures.PARENT);
    }

    @Test
    void windowMustBePositive() {
        ChatProperties properties = new ChatProperties();
        properties.setContextWindow(0);

        assertThatThrownBy(() -> new DefaultContextBuilder(store, registry, properties))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
