package com.conduit.streaming;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Identity shared by every chunk of one streaming response.
 */
@Getter
@ToString
@AllArgsConstructor
public class StreamSession {

    private final String id;
    private final long created;
    private final String model;

    public static StreamSession start(String model) {
        return new StreamSession(
                "chatcmpl-" + UUID.randomUUID().toString().replace("-", "").substring(0, 24),
                Instant.now().getEpochSecond(),
                model);
    }
}
