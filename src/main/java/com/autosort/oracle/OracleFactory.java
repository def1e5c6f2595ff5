package com.autosort.oracle;

import com.autosort.models.OracleEndpointConfig;
import com.autosort.models.OracleKind;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Creates oracles sharing one HTTP client.
 */
public class OracleFactory {

    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public OracleFactory(ObjectMapper mapper) {
        this.mapper = mapper;
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    public Oracle create(OracleEndpointConfig endpoint) {
        OracleKind kind = OracleKind.fromName(endpoint != null ? endpoint.getProvider() : null);
        OracleEndpointConfig config = endpoint != null ? endpoint : OracleEndpointConfig.defaultsFor(kind);
        switch (kind) {
            case LOCAL:
                return new OllamaOracle(config, mapper, httpClient);
            case OPENAI:
            case GROK:
            default:
                return new OpenAiCompatibleOracle(kind, config, mapper, httpClient);
        }
    }
}
