package com.autosort.oracle;

import com.autosort.AppLogger;
import com.autosort.models.OracleEndpointConfig;
import com.autosort.models.OracleKind;
import com.autosort.models.PromptContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for oracles with shared HTTP and retry logic.
 */
public abstract class AbstractOracle implements Oracle {

    private static final Pattern STATUS_CODE = Pattern.compile("\\((\\d{3})\\)");
    private static final long MAX_BACKOFF_MS = 10_000;

    protected final OracleKind kind;
    protected final OracleEndpointConfig endpoint;
    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;

    protected AbstractOracle(OracleKind kind, OracleEndpointConfig endpoint, ObjectMapper mapper, HttpClient httpClient) {
        this.kind = kind;
        this.endpoint = endpoint != null ? endpoint : OracleEndpointConfig.defaultsFor(kind);
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    @Override
    public OracleKind getKind() {
        return kind;
    }

    public OracleEndpointConfig getEndpoint() {
        return endpoint;
    }

    @Override
    public String suggest(PromptContext context) throws IOException, InterruptedException {
        String prompt = PromptShaper.shape(kind, PromptShaper.baseRequest(context), context.getProjectType());
        return complete(prompt);
    }

    @Override
    public String refine(PromptContext context, String candidate) throws IOException, InterruptedException {
        String prompt = PromptShaper.shape(kind, PromptShaper.refineRequest(context, candidate), context.getProjectType());
        return complete(prompt);
    }

    /**
     * Send one shaped prompt and return the model's text.
     */
    protected abstract String complete(String prompt) throws IOException, InterruptedException;

    protected JsonNode sendJsonPost(String url, JsonNode payload, String bearerAuth)
        throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(resolveTimeout())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));

        if (bearerAuth != null && !bearerAuth.isBlank()) {
            builder.header("Authorization", bearerAuth);
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Oracle request failed (" + status + "): " + response.body());
        }
        return mapper.readTree(response.body());
    }

    /**
     * Retries only the single call, with exponential backoff from the endpoint's base delay.
     */
    protected JsonNode sendJsonPostWithRetries(String url, JsonNode payload, String bearerAuth)
        throws IOException, InterruptedException {
        int retries = endpoint.getMaxRetries() != null ? Math.max(0, endpoint.getMaxRetries()) : 3;
        IOException lastIo = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return sendJsonPost(url, payload, bearerAuth);
            } catch (IOException e) {
                lastIo = e;
                if (attempt >= retries || !isRetryable(e)) {
                    throw e;
                }
                logWarning(kind.getProviderName() + " attempt " + (attempt + 1) + " failed, retrying: " + describe(e));
                sleepBackoff(attempt);
            }
        }
        throw lastIo != null ? lastIo : new IOException("Oracle request failed");
    }

    static boolean isRetryable(IOException e) {
        if (e == null) return false;
        if (e instanceof HttpTimeoutException || e instanceof ConnectException) return true;
        String msg = e.getMessage() != null ? e.getMessage() : "";
        if (msg.contains("EOF reached while reading")) return true;
        if (msg.contains("Connection reset")) return true;
        if (msg.contains("timed out") || msg.contains("Timeout")) return true;
        Matcher m = STATUS_CODE.matcher(msg);
        if (m.find()) {
            int code = Integer.parseInt(m.group(1));
            return code == 429 || (code >= 500 && code <= 599);
        }
        return false;
    }

    private void sleepBackoff(int attempt) throws InterruptedException {
        long base = endpoint.getRetryBaseDelayMs() != null ? Math.max(0, endpoint.getRetryBaseDelayMs()) : 1000L;
        long delay = base * (1L << Math.min(attempt, 10));
        long jitter = base > 0 ? ThreadLocalRandom.current().nextLong(0, Math.max(1, base / 4)) : 0;
        Thread.sleep(Math.min(MAX_BACKOFF_MS, delay + jitter));
    }

    protected Duration resolveTimeout() {
        Integer timeoutMs = endpoint.getTimeoutMs();
        if (timeoutMs != null && timeoutMs > 0) {
            return Duration.ofMillis(timeoutMs);
        }
        return Duration.ofMillis(kind.getDefaultTimeoutMs());
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    protected String resolveModel() {
        String model = endpoint.getModel();
        return model == null || model.isBlank() ? kind.getDefaultModel() : model;
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[Oracle] " + message);
        }
    }
}
