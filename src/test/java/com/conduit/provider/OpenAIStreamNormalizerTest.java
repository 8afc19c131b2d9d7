package com.conduit.provider;

import com.conduit.config.JacksonConfiguration;
import com.conduit.streaming.SseStreamProcessor;
import com.conduit.streaming.StreamEvent;
import com.conduit.streaming.StreamSession;
import com.conduit.streaming.StreamState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAIStreamNormalizerTest {

    private OpenAIStreamNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new OpenAIStreamNormalizer(JacksonConfiguration.createObjectMapper(),
                new StreamSession("chatcmpl-local", 1700000000L, "gpt-4"), "openai");
    }

    @Test
    void testForwardsRecordsUntouched() {
        String body = """
                data: {"id":"chatcmpl-up","object":"chat.completion.chunk","choices":[{"index":0,"delta":{"role":"assistant"},"finish_reason":null}]}

                data: {"id":"chatcmpl-up","object":"chat.completion.chunk","choices":[{"index":0,"delta":{"content":"Hi"},"finish_reason":null}]}

                data: {"id":"chatcmpl-up","object":"chat.completion.chunk","choices":[{"index":0,"delta":{},"finish_reason":"stop"}]}

                data: [DONE]

                """;

        List<StreamEvent> events = SseStreamProcessor.process(Flux.just(body), normalizer).collectList().block();

        assertNotNull(events);
        assertEquals(3, events.size());
        assertEquals(StreamEvent.Kind.RAW, events.get(0).getKind());
        assertEquals("chatcmpl-up", events.get(0).getRaw().path("id").asText());
        assertEquals("Hi", events.get(1).getRaw().path("choices").path(0).path("delta").path("content").asText());
        assertEquals(StreamState.COMPLETED, normalizer.getState());
    }

    @Test
    void testPrependsRoleChunkWhenUpstreamOmitsIt() {
        List<StreamEvent> events = normalizer.onLine(
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Hi\"},\"finish_reason\":null}]}");

        assertEquals(2, events.size());
        assertEquals(StreamEvent.Kind.CHUNK, events.get(0).getKind());
        assertEquals("assistant", events.get(0).getChunk().firstDelta().getRole());
        assertEquals("chatcmpl-local", events.get(0).getChunk().getId());
        assertEquals(StreamEvent.Kind.RAW, events.get(1).getKind());
    }

    @Test
    void testInBandErrorBecomesErrorEvent() {
        List<StreamEvent> events = normalizer.onLine(
                "data: {\"error\":{\"message\":\"Rate limited\",\"type\":\"requests\",\"code\":\"rate_limit_exceeded\"}}");

        assertEquals(1, events.size());
        assertTrue(events.get(0).isError());
        assertEquals("platform_error", events.get(0).getError().getError().getType());
        assertEquals("rate_limit_exceeded", events.get(0).getError().getError().getCode());
        assertEquals(StreamState.FAILED, normalizer.getState());
    }
}
