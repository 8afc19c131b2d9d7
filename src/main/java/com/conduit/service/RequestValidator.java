package com.conduit.service;

import com.conduit.exception.ValidationException;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.CompletionRequest;
import com.conduit.model.EmbeddingRequest;
import org.springframework.stereotype.Component;

/**
 * Range checks on inbound OpenAI requests.
 */
@Component
public class RequestValidator {

    public void validate(ChatCompletionRequest request) {
        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            throw new ValidationException("Messages cannot be empty", "messages");
        }
        checkSampling(request.getTemperature(), request.getTopP(), request.getN(), request.getMaxTokens());
        checkPenalty("presence_penalty", request.getPresencePenalty());
        checkPenalty("frequency_penalty", request.getFrequencyPenalty());
    }

    public void validate(CompletionRequest request) {
        if (request.getPrompt() == null) {
            throw new ValidationException("Prompt must be specified", "prompt");
        }
        checkSampling(request.getTemperature(), request.getTopP(), request.getN(), request.getMaxTokens());
        checkPenalty("presence_penalty", request.getPresencePenalty());
        checkPenalty("frequency_penalty", request.getFrequencyPenalty());
    }

    public void validate(EmbeddingRequest request) {
        if (request.getInput() == null) {
            throw new ValidationException("Input must be specified", "input");
        }
    }

    private static void checkSampling(Double temperature, Double topP, Integer n, Integer maxTokens) {
        if (temperature != null && (temperature < 0 || temperature > 2)) {
            throw new ValidationException("temperature must be between 0 and 2", "temperature");
        }
        if (topP != null && (topP < 0 || topP > 1)) {
            throw new ValidationException("top_p must be between 0 and 1", "top_p");
        }
        if (n != null && n < 1) {
            throw new ValidationException("n must be at least 1", "n");
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new ValidationException("max_tokens must be greater than 0", "max_tokens");
        }
    }

    private static void checkPenalty(String name, Double value) {
        if (value != null && (value < -2 || value > 2)) {
            throw new ValidationException(name + " must be between -2 and 2", name);
        }
    }
}
