package com.autosort.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class OracleEndpointConfig {

    private String provider;
    private String model;
    private String baseUrl;
    private String apiKey;
    private Double temperature;
    private Integer maxOutputTokens;
    private Integer timeoutMs;
    private Integer maxRetries;
    private Long retryBaseDelayMs;

    public static OracleEndpointConfig defaultsFor(OracleKind kind) {
        OracleEndpointConfig config = new OracleEndpointConfig();
        config.setProvider(kind.getProviderName());
        config.setModel(kind.getDefaultModel());
        config.setBaseUrl(kind.getDefaultBaseUrl());
        config.setTemperature(0.1);
        config.setMaxOutputTokens(50);
        config.setTimeoutMs(kind.getDefaultTimeoutMs());
        config.setMaxRetries(3);
        config.setRetryBaseDelayMs(1000L);
        return config;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public void setMaxOutputTokens(Integer maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Integer timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(Integer maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Long getRetryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public void setRetryBaseDelayMs(Long retryBaseDelayMs) {
        this.retryBaseDelayMs = retryBaseDelayMs;
    }
}
