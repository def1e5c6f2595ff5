package com.autosort.models;

import java.util.Locale;

/**
 * Supported path-suggestion oracles: one local model runner and two hosted APIs.
 */
public enum OracleKind {
    LOCAL("ollama", "http://localhost:11434", "llama3.1", 30_000),
    OPENAI("openai", "https://api.openai.com", "gpt-4o-mini", 60_000),
    GROK("grok", "https://api.x.ai", "grok-2-mini", 60_000);

    private final String providerName;
    private final String defaultBaseUrl;
    private final String defaultModel;
    private final int defaultTimeoutMs;

    OracleKind(String providerName, String defaultBaseUrl, String defaultModel, int defaultTimeoutMs) {
        this.providerName = providerName;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModel = defaultModel;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public int getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public boolean isHosted() {
        return this != LOCAL;
    }

    /**
     * Resolve a provider name ("ollama", "local", "openai", "grok", "xai") to a kind.
     */
    public static OracleKind fromName(String name) {
        if (name == null || name.isBlank()) {
            return LOCAL;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "ollama":
            case "local":
                return LOCAL;
            case "openai":
                return OPENAI;
            case "grok":
            case "xai":
                return GROK;
            default:
                throw new IllegalArgumentException("Unknown oracle provider: " + name);
        }
    }
}
