package com.conduit.security;

import com.conduit.config.ConduitProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.Set;

/**
 * Authenticates against the keys listed under {@code conduit.auth.api-keys}.
 */
@Component
public class ConfiguredKeyAuthenticator implements ClientAuthenticator {

    private final ConduitProperties properties;

    public ConfiguredKeyAuthenticator(ConduitProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<Set<String>> authenticate(String apiKey) {
        if (!StringUtils.hasText(apiKey)) {
            return Optional.empty();
        }
        Set<String> permissions = properties.getAuth().getApiKeys().get(apiKey);
        return permissions == null ? Optional.empty() : Optional.of(Set.copyOf(permissions));
    }
}
