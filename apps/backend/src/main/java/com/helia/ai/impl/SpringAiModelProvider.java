package com.helia.ai.impl;

import com.helia.ai.ModelProvider;
import com.helia.domain.PersonaConfig;
import com.helia.domain.PromptContext;
import com.helia.error.ProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link ModelProvider} over a Spring AI {@link ChatModel}. The concrete model (OpenAI by default)
 * is whatever the Spring AI starter on the classpath contributes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiModelProvider implements ModelProvider {

    private static final List<String> CONTENT_FILTER_MARKERS = List.of(
            "content_filter", "content management policy", "responsibleaipolicyviolation");

    private final ChatModel chatModel;

    @Override
    public Flux<String> stream(PersonaConfig persona, PromptContext context) {
        return Flux.defer(() -> chatModel.stream(toPrompt(context)))
                .doOnSubscribe(s -> log.debug("[MODEL] stream start sessionId={} personaId={} messages={}",
                        context.sessionId(), persona.personaId(), context.messages().size()))
                .handle((ChatResponse response, SynchronousSink<String> sink) -> {
                    Generation generation = response == null ? null : response.getResult();
                    if (generation == null) {
                        return;
                    }
                    if (isContentFilterFinish(generation)) {
                        sink.error(ProviderException.contentFiltered("Response blocked by the provider content filter"));
                        return;
                    }
                    AssistantMessage output = generation.getOutput();
                    String text = output == null ? null : output.getText();
                    if (text != null && !text.isEmpty()) {
                        sink.next(text);
                    }
                })
                .onErrorMap(ex -> !(ex instanceof ProviderException), this::toProviderException)
                .doOnCancel(() -> log.debug("[MODEL] stream cancelled sessionId={}", context.sessionId()));
    }

    Prompt toPrompt(PromptContext context) {
        List<Message> messages = new ArrayList<>(context.messages().size());
        for (PromptContext.Entry entry : context.messages()) {
            messages.add(switch (entry.kind()) {
                case SYSTEM -> new SystemMessage(entry.content());
                case USER -> new UserMessage(entry.content());
                case ASSISTANT -> new AssistantMessage(entry.content());
            });
        }
        return new Prompt(messages);
    }

    private ProviderException toProviderException(Throwable ex) {
        boolean filtered = mentionsContentFilter(ex);
        log.warn("[MODEL] provider failure contentFiltered={} err={}", filtered, ex.toString());
        return new ProviderException(ex.getMessage(), ex, filtered);
    }

    private static boolean isContentFilterFinish(Generation generation) {
        if (generation.getMetadata() == null) {
            return false;
        }
        String reason = generation.getMetadata().getFinishReason();
        return reason != null && reason.toLowerCase(Locale.ROOT).contains("content_filter");
    }

    private static boolean mentionsContentFilter(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause() == t ? null : t.getCause()) {
            String message = t.getMessage();
            if (message == null) {
                continue;
            }
            String lower = message.toLowerCase(Locale.ROOT);
            if (CONTENT_FILTER_MARKERS.stream().anyMatch(lower::contains)) {
                return true;
            }
        }
        return false;
    }
}
