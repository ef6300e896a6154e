package com.helia.service;

import com.helia.ai.ContentFilterResponder;
import com.helia.ai.ModelProvider;
import com.helia.config.ChatProperties;
import com.helia.domain.ChatMessage;
import com.helia.domain.ChatTurn;
import com.helia.domain.MessageRole;
import com.helia.domain.MessageState;
import com.helia.domain.PersonaConfig;
import com.helia.domain.Session;
import com.helia.domain.StreamState;
import com.helia.domain.TurnCommand;
import com.helia.domain.TurnEvent;
import com.helia.domain.TurnState;
import com.helia.error.ChatException;
import com.helia.error.ProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs one chat turn:
 * <ol>
 *   <li>validate ownership and persona (no writes on failure)</li>
 *   <li>persist the user message before the model is called</li>
 *   <li>forward provider chunks in order while accumulating them</li>
 *   <li>persist the accumulated reply as exactly one assistant message</li>
 * </ol>
 * When the stream fails, times out or the caller goes away, whatever was already streamed is
 * stored once as a {@link MessageState#PARTIAL} assistant message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamingChatEngine {

    /** Storage writes that must finish even when the subscriber has gone. */
    private static final Executor DETACHED = task -> Schedulers.boundedElastic().schedule(task);

    private final ConversationStore store;
    private final PersonaRegistry personaRegistry;
    private final SessionManager sessionManager;
    private final ContextBuilder contextBuilder;
    private final ModelProvider modelProvider;
    private final ContentFilterResponder contentFilterResponder;
    private final ChatProperties properties;
    private final Clock clock;

    public Flux<TurnEvent> send(String ownerId, TurnCommand command) {
        return open(ownerId, command).flatMapMany(this::stream);
    }

    /**
     * Validation and user-message persistence. Errors here are reported before any byte of the
     * stream is produced.
     */
    public Mono<ChatTurn> open(String ownerId, TurnCommand command) {
        return Mono.fromCallable(() -> openTurn(ownerId, command))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Flux<TurnEvent> stream(ChatTurn turn) {
        StreamState state = new StreamState(turn.sessionId(), clock.instant());
        AtomicBoolean committed = new AtomicBoolean(false);

        Flux<TurnEvent> chunks = Mono.fromCallable(() -> contextBuilder.build(turn.session()))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(ctx -> turn.moveTo(TurnState.STREAMING))
                .flatMapMany(ctx -> modelProvider.stream(turn.persona(), ctx))
                .transform(this::boundByTurnTimeout)
                .onErrorResume(ProviderException.class, ex -> refuseIfFiltered(turn, state, ex))
                .doOnNext(state::append)
                .map(chunk -> TurnEvent.chunk(turn.sessionId(), chunk));

        Flux<TurnEvent> events = chunks
                .concatWith(Mono.defer(() -> finish(turn, state, committed)))
                .onErrorResume(ex -> failTurn(turn, state, committed, ex))
                .doOnCancel(() -> cancelTurn(turn, state, committed));

        return turn.sessionCreated()
                ? Flux.just(TurnEvent.session(turn.session())).concatWith(events)
                : events;
    }

    private ChatTurn openTurn(String ownerId, TurnCommand command) {
        ChatTurn turn = new ChatTurn(ownerId, clock.instant());
        turn.moveTo(TurnState.VALIDATING);
        Session created = null;
        try {
            String text = requireText(command);
            Session session;
            if (StringUtils.hasText(command.sessionId())) {
                session = store.findSession(ownerId, command.sessionId());
            } else {
                session = sessionManager.create(ownerId, command.personaId(), text);
                created = session;
            }
            PersonaConfig persona = personaRegistry.resolve(session.personaId());
            turn.bind(session, persona, created != null);

            turn.moveTo(TurnState.PERSISTING_USER_MESSAGE);
            ChatMessage userMessage = persist("user message",
                    () -> store.appendMessage(session.id(), MessageRole.USER, text, MessageState.FINAL, command.imageUrl()));
            log.info("Turn opened ownerId={} sessionId={} personaId={} seq={}",
                    ownerId, session.id(), persona.personaId(), userMessage.sequence());
            return turn;
        } catch (RuntimeException ex) {
            turn.fail(ex);
            log.info("Turn rejected ownerId={} sessionId={} err={}",
                    ownerId, command == null ? null : command.sessionId(), ex.toString());
            if (created != null) {
                discardImplicitSession(ownerId, created, ex);
            }
            throw ex;
        }
    }

    /** Removes a session opened by this turn; its id never reached the caller. */
    private void discardImplicitSession(String ownerId, Session session, RuntimeException cause) {
        try {
            store.deleteSession(ownerId, session.id());
            log.info("Implicit session discarded ownerId={} sessionId={}", ownerId, session.id());
        } catch (RuntimeException cleanup) {
            log.error("Implicit session left behind ownerId={} sessionId={}", ownerId, session.id(), cleanup);
            cause.addSuppressed(cleanup);
        }
    }

    private String requireText(TurnCommand command) {
        if (command == null || !StringUtils.hasText(command.text())) {
            throw ChatException.invalidInput("message must not be blank");
        }
        if (command.text().length() > properties.getMaxMessageLength()) {
            throw ChatException.invalidInput("message exceeds " + properties.getMaxMessageLength() + " characters");
        }
        return command.text();
    }

    private Flux<String> boundByTurnTimeout(Flux<String> chunks) {
        Duration limit = properties.getTurnTimeout();
        AtomicBoolean expired = new AtomicBoolean(false);
        // takeUntilOther cancels the provider stream when the deadline fires
        return chunks
                .takeUntilOther(Mono.delay(limit).doOnNext(tick -> expired.set(true)))
                .concatWith(Mono.defer(() -> expired.get()
                        ? Mono.error(ChatException.turnTimeout(limit))
                        : Mono.empty()));
    }

    private Flux<String> refuseIfFiltered(ChatTurn turn, StreamState state, ProviderException ex) {
        if (!ex.isContentFiltered() || !state.isEmpty()) {
            return Flux.error(ex);
        }
        log.info("Turn answered with content-filter refusal sessionId={} personaId={}",
                turn.sessionId(), turn.persona().personaId());
        return Flux.just(contentFilterResponder.refusal(turn.persona(), ex));
    }

    private Mono<TurnEvent> finish(ChatTurn turn, StreamState state, AtomicBoolean committed) {
        turn.moveTo(TurnState.FINALIZING);
        return commit(turn, state, committed, MessageState.FINAL)
                .map(message -> {
                    turn.moveTo(TurnState.DONE);
                    Instant now = clock.instant();
                    log.info("Turn done sessionId={} seq={} chunks={} chars={} streamMs={} totalMs={}",
                            turn.sessionId(), message.sequence(), state.chunkCount(), message.content().length(),
                            Duration.between(state.startedAt(), now).toMillis(),
                            Duration.between(turn.openedAt(), now).toMillis());
                    return TurnEvent.end(message);
                });
    }

    private Flux<TurnEvent> failTurn(ChatTurn turn, StreamState state, AtomicBoolean committed, Throwable ex) {
        ChatException failure = asChatException(ex);
        turn.fail(failure);
        log.warn("Turn failed sessionId={} code={} chunks={} err={}",
                turn.sessionId(), failure.code(), state.chunkCount(), ex.toString());
        if (state.isEmpty() || committed.get()) {
            return Flux.error(failure);
        }
        return commit(turn, state, committed, MessageState.PARTIAL)
                .doOnNext(message -> log.info("Partial reply kept sessionId={} seq={} chars={}",
                        turn.sessionId(), message.sequence(), message.content().length()))
                .onErrorResume(storageEx -> {
                    log.error("Partial reply lost sessionId={} chars={} cause={}",
                            turn.sessionId(), state.content().length(), failure.toString(), storageEx);
                    storageEx.addSuppressed(failure);
                    return Mono.error(storageEx);
                })
                .thenMany(Flux.error(failure));
    }

    /**
     * A cancel that lands after the last chunk but before {@code finish} stores the whole reply as
     * PARTIAL: the stream never confirmed completion to the caller, and {@code committed} keeps it
     * to a single write either way.
     */
    private void cancelTurn(ChatTurn turn, StreamState state, AtomicBoolean committed) {
        turn.fail(new CancellationException("caller cancelled the stream"));
        log.info("Turn cancelled by caller sessionId={} chunks={}", turn.sessionId(), state.chunkCount());
        if (state.isEmpty() || committed.get()) {
            return;
        }
        commit(turn, state, committed, MessageState.PARTIAL)
                .subscribe(
                        message -> log.info("Partial reply kept after cancel sessionId={} seq={}",
                                turn.sessionId(), message.sequence()),
                        err -> log.error("Partial reply lost after cancel sessionId={}", turn.sessionId(), err));
    }

    /** At most one assistant write per turn, guarded by {@code committed}. */
    private Mono<ChatMessage> commit(ChatTurn turn, StreamState state, AtomicBoolean committed, MessageState messageState) {
        return Mono.defer(() -> {
            if (!committed.compareAndSet(false, true)) {
                return Mono.empty();
            }
            String content = state.content();
            return Mono.fromFuture(CompletableFuture.supplyAsync(() -> persist("assistant message",
                    () -> store.appendMessage(turn.sessionId(), MessageRole.ASSISTANT, content, messageState, null)),
                    DETACHED))
                    .onErrorMap(CompletionException.class, ex -> ex.getCause() != null ? ex.getCause() : ex);
        });
    }

    private <T> T persist(String what, Supplier<T> write) {
        try {
            return write.get();
        } catch (ChatException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw ChatException.storage(what, ex);
        }
    }

    private static ChatException asChatException(Throwable ex) {
        Throwable cause = ex;
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ChatException chat) {
            return chat;
        }
        return new ProviderException(cause.getMessage(), cause, false);
    }
}
