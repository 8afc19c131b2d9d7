package com.conduit.security;

import com.conduit.config.ConduitProperties;
import com.conduit.exception.ErrorType;
import com.conduit.model.ErrorResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Enforces per-path permissions on {@code /v1} when {@code conduit.auth.enabled} is set.
 */
@Slf4j
@Component
public class ApiKeyAuthWebFilter implements WebFilter {

    public static final String PERMISSIONS_ATTR = "CONDUIT_CLIENT_PERMISSIONS";

    private static final String AUTH_PREFIX = "Bearer ";

    private final ConduitProperties properties;
    private final ClientAuthenticator authenticator;
    private final ObjectMapper objectMapper;

    public ApiKeyAuthWebFilter(ConduitProperties properties, ClientAuthenticator authenticator,
                               ObjectMapper objectMapper) {
        this.properties = properties;
        this.authenticator = authenticator;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!properties.getAuth().isEnabled()) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        String required = requiredPermission(path);
        if (required == null || HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod())) {
            return chain.filter(exchange);
        }

        String token = resolveBearerToken(exchange);
        Set<String> permissions = authenticator.authenticate(token).orElse(null);
        if (permissions == null) {
            return writeError(exchange, ErrorType.AUTHENTICATION, "Invalid API key", "invalid_api_key");
        }
        if (!permissions.contains(required) && !permissions.contains(ClientAuthenticator.ADMIN)) {
            log.warn("Client lacks '{}' permission for {}", required, path);
            return writeError(exchange, ErrorType.PERMISSION,
                    "API key lacks the '" + required + "' permission", "insufficient_permissions");
        }

        exchange.getAttributes().put(PERMISSIONS_ATTR, permissions);
        return chain.filter(exchange);
    }

    static String requiredPermission(String path) {
        if (!StringUtils.hasText(path) || !path.startsWith("/v1/")) {
            return null;
        }
        if (path.startsWith("/v1/admin/")) {
            return ClientAuthenticator.ADMIN;
        }
        return switch (path) {
            case "/v1/chat/completions", "/v1/models" -> ClientAuthenticator.CHAT;
            case "/v1/completions" -> ClientAuthenticator.COMPLETION;
            case "/v1/embeddings" -> ClientAuthenticator.EMBEDDING;
            default -> null;
        };
    }

    private String resolveBearerToken(ServerWebExchange exchange) {
        String authorization = exchange.getRequest().getHeaders().getFirst("Authorization");
        if (!StringUtils.hasText(authorization) || !authorization.startsWith(AUTH_PREFIX)) {
            return null;
        }
        String token = authorization.substring(AUTH_PREFIX.length()).trim();
        return StringUtils.hasText(token) ? token : null;
    }

    private Mono<Void> writeError(ServerWebExchange exchange, ErrorType type, String message, String code) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(ErrorResponse.of(message, type.getValue(), code));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        HttpStatus status = type.getStatus();
        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return exchange.getResponse().writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(body)));
    }
}
