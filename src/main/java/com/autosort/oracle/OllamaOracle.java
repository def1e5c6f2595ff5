package com.autosort.oracle;

import com.autosort.models.OracleEndpointConfig;
import com.autosort.models.OracleKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;

/**
 * Local model runner over the Ollama generate API.
 */
public class OllamaOracle extends AbstractOracle {

    static final List<String> STOP_SEQUENCES = List.of("\n\n", "Path:", "Folder:", "Directory:", "Response:");

    public OllamaOracle(OracleEndpointConfig endpoint, ObjectMapper mapper, HttpClient httpClient) {
        super(OracleKind.LOCAL, endpoint, mapper, httpClient);
    }

    @Override
    protected String complete(String prompt) throws IOException, InterruptedException {
        String url = normalizeBaseUrl(endpoint.getBaseUrl(), kind.getDefaultBaseUrl()) + "/api/generate";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", resolveModel());
        payload.put("prompt", prompt);
        payload.put("stream", false);

        ObjectNode options = payload.putObject("options");
        if (endpoint.getTemperature() != null) {
            options.put("temperature", endpoint.getTemperature());
        }
        if (endpoint.getMaxOutputTokens() != null) {
            options.put("num_predict", endpoint.getMaxOutputTokens());
        }
        ArrayNode stop = options.putArray("stop");
        STOP_SEQUENCES.forEach(stop::add);

        JsonNode response = sendJsonPostWithRetries(url, payload, null);

        JsonNode text = response.path("response");
        if (!text.isMissingNode()) {
            return text.asText().trim();
        }
        JsonNode content = response.path("message").path("content");
        if (!content.isMissingNode()) {
            return content.asText().trim();
        }
        return response.toString();
    }
}
