package com.conduit.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.springframework.http.HttpHeaders;

/**
 * Envelope of one non-streaming upstream call. {@code json} is null when the body is not JSON.
 */
@Getter
@ToString(exclude = "rawBytes")
@AllArgsConstructor
public class UpstreamResponse {

    private final int statusCode;
    private final HttpHeaders headers;
    private final byte[] rawBytes;
    private final JsonNode json;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean hasJson() {
        return json != null && !json.isMissingNode() && !json.isNull();
    }
}
