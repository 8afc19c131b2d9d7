package com.conduit.security;

import java.util.Optional;
import java.util.Set;

/**
 * Resolves an inbound API key into the permissions it grants.
 */
public interface ClientAuthenticator {

    String CHAT = "chat";
    String COMPLETION = "completion";
    String EMBEDDING = "embedding";
    String ADMIN = "admin";

    /**
     * @return the permission set, or empty if the key is unknown
     */
    Optional<Set<String>> authenticate(String apiKey);
}
