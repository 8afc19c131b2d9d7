package com.conduit.provider;

import com.conduit.exception.ErrorType;
import com.conduit.model.ErrorResponse;
import com.conduit.streaming.AbstractStreamNormalizer;
import com.conduit.streaming.StreamEvent;
import com.conduit.streaming.StreamSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Forwards OpenAI chunk records as-is. The upstream {@code [DONE]} marker is consumed,
 * since the gateway writes its own terminator, and in-band {@code error} records end the stream.
 */
public class OpenAIStreamNormalizer extends AbstractStreamNormalizer {

    private final String platformName;

    public OpenAIStreamNormalizer(ObjectMapper objectMapper, StreamSession session, String platformName) {
        super(objectMapper, session);
        this.platformName = platformName;
    }

    @Override
    protected String platformName() {
        return platformName;
    }

    @Override
    protected void handleData(String eventType, JsonNode data, List<StreamEvent> out) {
        if (data.has("error")) {
            JsonNode error = data.path("error");
            ErrorResponse response = ErrorResponse.of(
                    error.path("message").asText("Upstream stream error"),
                    ErrorType.PLATFORM.getValue(),
                    error.hasNonNull("code") ? error.get("code").asText() : error.path("type").asText(null));
            emitError(out, response);
            return;
        }

        JsonNode choice = data.path("choices").path(0);
        if (choice.isMissingNode()) {
            // usage-only trailer records
            emitRaw(out, data, true);
            return;
        }

        emitRaw(out, data, choice.path("delta").hasNonNull("role"));
        if (choice.hasNonNull("finish_reason")) {
            markCompleted();
        }
    }
}
