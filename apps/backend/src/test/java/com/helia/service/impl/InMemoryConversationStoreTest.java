package com.helia.service.impl;

import com.helia.domain.ChatMessage;
import com.helia.domain.MessageRole;
import com.helia.domain.MessageState;
import com.helia.domain.Session;
import com.helia.error.ChatException;
import com.helia.error.ErrorCode;
import com.helia.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryConversationStoreTest {

    private InMemoryConversationStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStore(TestFixtures.personaRegistry(), new SessionLocks(),
                new TestFixtures.TickingClock());
    }

    @Test
    void appendAssignsGaplessSequenceAndBumpsUpdatedAt() {
        Session session = store.createSession("alice", TestFixtures.PARENT, "Sleep");

        ChatMessage first = store.appendMessage(session.id(), MessageRole.USER, "hi", MessageState.FINAL, null);
        ChatMessage second = store.appendMessage(session.id(), MessageRole.ASSISTANT, "hello", MessageState.FINAL, null);

        assertThat(first.sequence()).isEqualTo(1);
        assertThat(second.sequence()).isEqualTo(2);
        Session reloaded = store.findSession("alice", session.id());
        assertThat(reloaded.updatedAt()).isEqualTo(second.createdAt()).isAfter(session.updatedAt());
        assertThat(store.listMessages("alice", session.id()))
                .extracting(ChatMessage::role)
                .containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
    }

    @Test
    void concurrentAppendsToOneSessionStayTotallyOrdered() throws Exception {
        Session session = store.createSession("alice", TestFixtures.PARENT, "Busy");
        int writers = 8;
        int perWriter = 50;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        store.appendMessage(session.id(), MessageRole.USER, "m", MessageState.FINAL, null);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<ChatMessage> history = store.listMessages("alice", session.id());
        assertThat(history).extracting(ChatMessage::sequence)
                .containsExactlyElementsOf(LongStream.rangeClosed(1, (long) writers * perWriter).boxed().toList());
    }

    @Test
    void foreignSessionLooksMissing() {
        Session session = store.createSession("alice", TestFixtures.PARENT, "Private");

        assertNotFound(() -> store.findSession("mallory", session.id()));
        assertNotFound(() -> store.listMessages("mallory", session.id()));
        assertNotFound(() -> store.renameSession("mallory", session.id(), "Mine"));
        assertNotFound(() -> store.deleteSession("mallory", session.id()));
        assertNotFound(() -> store.findSession("alice", "does-not-exist"));
        assertThat(store.listSessions("mallory", 20)).isEmpty();
    }

    @Test
    void renameKeepsUpdatedAtPersonaAndMessages() {
        Session session = store.createSession("alice", TestFixtures.PARENT, "Old");
        store.appendMessage(session.id(), MessageRole.USER, "hi", MessageState.FINAL, null);
        Session before = store.findSession("alice", session.id());

        Session renamed = store.renameSession("alice", session.id(), "New");

        assertThat(renamed.title()).isEqualTo("New");
        assertThat(renamed.updatedAt()).isEqualTo(before.updatedAt());
        assertThat(renamed.personaId()).isEqualTo(TestFixtures.PARENT);
        assertThat(store.listMessages("alice", session.id())).hasSize(1);
    }

    @Test
    void deleteRemovesSessionAndMessages() {
        Session session = store.createSession("alice", TestFixtures.PARENT, "Gone soon");
        store.appendMessage(session.id(), MessageRole.USER, "hi", MessageState.FINAL, null);

        store.deleteSession("alice", session.id());

        assertNotFound(() -> store.listMessages("alice", session.id()));
        assertNotFound(() -> store.appendMessage(session.id(), MessageRole.USER, "late", MessageState.FINAL, null));
        assertThat(store.listSessions("alice", 20)).isEmpty();
    }

    @Test
    void listReturnsMostRecentlyActiveFirstWithinLimit() {
        Session older = store.createSession("alice", TestFixtures.PARENT, "Older");
        Session newer = store.createSession("alice", TestFixtures.PARENT, "Newer");
        store.createSession("bob", TestFixtures.PARENT, "Bob's");
        store.appendMessage(older.id(), MessageRole.USER, "bump", MessageState.FINAL, null);

        assertThat(store.listSessions("alice", 20)).extracting(Session::id)
                .containsExactly(older.id(), newer.id());
        assertThat(store.listSessions("alice", 1)).extracting(Session::id)
                .containsExactly(older.id());
    }

    @Test
    void recentMessagesReturnsTrailingWindowOldestFirst() {
        Session session = store.createSession("alice", TestFixtures.PARENT, "Window");
        for (int i = 1; i <= 5; i++) {
            store.appendMessage(session.id(), MessageRole.USER, "m" + i, MessageState.FINAL, null);
        }

        assertThat(store.recentMessages(session.id(), 3)).extracting(ChatMessage::content)
                .containsExactly("m3", "m4", "m5");
        assertThat(store.recentMessages(session.id(), 10)).hasSize(5);
    }

    @Test
    void createWithUnknownPersonaFails() {
        assertThatThrownBy(() -> store.createSession("alice", "ghost", "x"))
                .isInstanceOf(ChatException.class)
                .satisfies(ex -> assertThat(((ChatException) ex).code()).isEqualTo(ErrorCode.INVALID_PERSONA));
    }

    @Test
    void readsDuringDeleteSeeAllMessagesOrNothing() throws Exception {
        int messages = 20;
        int readers = 3;
        for (int round = 0; round < 50; round++) {
            String owner = "alice-" + round;
            Session session = store.createSession(owner, "supportive-parent", "Doomed " + round);
            for (int i = 0; i < messages; i++) {
                store.appendMessage(session.id(), MessageRole.USER, "m" + i, MessageState.FINAL, null);
            }

            ExecutorService pool = Executors.newFixedThreadPool(readers);
            CountDownLatch start = new CountDownLatch(1);
            AtomicBoolean deleted = new AtomicBoolean(false);
            try {
                List<Future<Integer>> futures = new ArrayList<>();
                for (int r = 0; r < readers; r++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        int observed = 0;
                        while (true) {
                            boolean deleteFinished = deleted.get();
                            try {
                                assertThat(store.listMessages(owner, session.id())).hasSize(messages);
                                assertThat(store.findSession(owner, session.id()).id()).isEqualTo(session.id());
                                observed++;
                            } catch (ChatException ex) {
                                assertThat(ex.code()).isEqualTo(ErrorCode.NOT_FOUND);
                                return observed;
                            }
                            if (deleteFinished) {
                                throw new AssertionError("session still readable after delete returned");
                            }
                        }
                    }));
                }
                start.countDown();
                store.deleteSession(owner, session.id());
                deleted.set(true);
                for (Future<Integer> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    private static void assertNotFound(Runnable action) {
        assertThatThrownBy(action::run)
                .isInstanceOf(ChatException.class)
                .satisfies(ex -> assertThat(((ChatException) ex).code()).isEqualTo(ErrorCode.NOT_FOUND));
    }
}
