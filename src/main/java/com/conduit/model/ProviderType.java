package com.conduit.model;

import java.util.Locale;

/**
 * Upstream provider type tags accepted in {@code conduit.provider.type}.
 */
public enum ProviderType {
    OPENAI("openai"),
    ANTHROPIC("anthropic"),
    GOOGLE("google"),
    AZURE_OPENAI("azure_openai"),
    COHERE("cohere"),
    COZE("coze"),
    CUSTOM("custom");

    private final String tag;

    ProviderType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Resolve a type tag, or null if the tag is unknown.
     */
    public static ProviderType fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ProviderType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
