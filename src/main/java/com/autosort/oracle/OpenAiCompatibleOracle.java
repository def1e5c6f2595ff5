package com.autosort.oracle;

import com.autosort.models.OracleEndpointConfig;
import com.autosort.models.OracleKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpClient;

/**
 * Hosted chat-completions oracle. Handles: openai, grok
 */
public class OpenAiCompatibleOracle extends AbstractOracle {

    public OpenAiCompatibleOracle(OracleKind kind, OracleEndpointConfig endpoint, ObjectMapper mapper,
                                  HttpClient httpClient) {
        super(kind, endpoint, mapper, httpClient);
        if (!kind.isHosted()) {
            throw new IllegalArgumentException("Not a hosted oracle: " + kind);
        }
    }

    @Override
    protected String complete(String prompt) throws IOException, InterruptedException {
        String apiKey = endpoint.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new IOException("API key required for " + kind.getProviderName());
        }
        String url = normalizeOpenAiBaseUrl(endpoint.getBaseUrl(), kind.getDefaultBaseUrl()) + "/v1/chat/completions";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", resolveModel());

        ArrayNode messages = payload.putArray("messages");
        String system = PromptShaper.systemMessage(kind);
        if (system != null) {
            ObjectNode sys = messages.addObject();
            sys.put("role", "system");
            sys.put("content", system);
        }
        ObjectNode msg = messages.addObject();
        msg.put("role", "user");
        msg.put("content", prompt);

        if (endpoint.getTemperature() != null) {
            payload.put("temperature", endpoint.getTemperature());
        }
        if (endpoint.getMaxOutputTokens() != null) {
            payload.put("max_tokens", endpoint.getMaxOutputTokens());
        }
        ArrayNode stop = payload.putArray("stop");
        stop.add("\n\n");
        stop.add("Path:");
        stop.add("Folder:");
        stop.add("Response:");

        JsonNode response = sendJsonPostWithRetries(url, payload, "Bearer " + apiKey);

        JsonNode choices = response.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode choice = choices.get(0);
            JsonNode content = choice.path("message").path("content");
            if (!content.isMissingNode() && !content.isNull()) {
                return content.asText().trim();
            }
            JsonNode text = choice.path("text");
            if (!text.isMissingNode()) {
                return text.asText().trim();
            }
        }
        return "Error: No response from " + kind.getProviderName();
    }

    private String normalizeOpenAiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}
