package com.conduit.streaming;

import com.conduit.exception.ErrorPayloads;
import com.conduit.model.ErrorResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.List;

/**
 * Replays a complete OpenAI chat completion as a stream, for providers without native
 * streaming. A response produces exactly three chunks (role, content, stop); an error
 * payload produces a single error event.
 */
@Slf4j
public class StreamSynthesizer {

    private final ObjectMapper objectMapper;

    public StreamSynthesizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Flux<StreamEvent> synthesize(JsonNode response, String requestedModel) {
        if (response.has("error")) {
            return Flux.just(StreamEvent.error(toError(response)));
        }

        StreamSession session = sessionFor(response, requestedModel);
        JsonNode choice = response.path("choices").path(0);
        String content = choice.path("message").path("content").asText("");
        String finishReason = choice.path("finish_reason").isTextual()
                ? choice.path("finish_reason").asText()
                : "stop";

        List<StreamEvent> events = List.of(
                StreamEvent.chunk(ChunkFactory.start(session)),
                StreamEvent.chunk(ChunkFactory.content(session, content)),
                StreamEvent.chunk(ChunkFactory.stop(session, finishReason)));

        log.debug("Synthesized {} chunks for response {}", events.size(), session.getId());
        return Flux.fromIterable(events);
    }

    private StreamSession sessionFor(JsonNode response, String requestedModel) {
        StreamSession fresh = StreamSession.start(requestedModel);
        String id = response.path("id").asText("");
        long created = response.path("created").canConvertToLong()
                ? response.path("created").asLong()
                : Instant.now().getEpochSecond();
        String model = response.path("model").asText("");
        return new StreamSession(
                id.isEmpty() ? fresh.getId() : id,
                created,
                model.isEmpty() ? requestedModel : model);
    }

    private ErrorResponse toError(JsonNode response) {
        try {
            return objectMapper.treeToValue(response, ErrorResponse.class);
        } catch (JsonProcessingException e) {
            return ErrorPayloads.fromThrowable(e);
        }
    }
}
