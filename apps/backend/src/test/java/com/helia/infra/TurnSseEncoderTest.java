package com.helia.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.helia.domain.ChatMessage;
import com.helia.domain.MessageRole;
import com.helia.domain.MessageState;
import com.helia.domain.TurnEvent;
import com.helia.error.ChatException;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TurnSseEncoderTest {

    private final TurnSseEncoder encoder = new TurnSseEncoder(new ObjectMapper());

    @Test
    void chunkIsAMessageEvent() {
        ServerSentEvent<String> event = encoder.encode(TurnEvent.chunk("s-1", "Hello"));

        assertThat(event.event()).isEqualTo("message");
        assertThat(event.data()).isEqualTo("Hello");
    }

    @Test
    void endCarriesMarkerAndMessageId() {
        ChatMessage stored = new ChatMessage("m-2", "s-1", 2, MessageRole.ASSISTANT, "Hello",
                MessageState.FINAL, null, Instant.EPOCH);

        ServerSentEvent<String> event = encoder.encode(TurnEvent.end(stored));

        assertThat(event.event()).isEqualTo("end");
        assertThat(event.data()).isEqualTo("END");
        assertThat(event.id()).isEqualTo("m-2");
    }

    @Test
    void errorEventCarriesCode() {
        ServerSentEvent<String> event = encoder.error(ChatException.turnTimeout(Duration.ofSeconds(2)));

        assertThat(event.event()).isEqualTo("error");
        assertThat(event.data()).contains("\"code\":\"TURN_TIMEOUT\"").contains("2000 ms");
    }

    @Test
    void foreignErrorIsReportedAsProviderError() {
        assertThat(encoder.error(new IllegalStateException("x")).data()).contains("PROVIDER_ERROR");
    }
}
