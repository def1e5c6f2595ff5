package com.autosort;

import com.autosort.models.OracleEndpointConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    private AppConfig.Builder builder() {
        return new AppConfig.Builder()
            .dataDirectory(tempDir.resolve("data"))
            .logDirectory(tempDir.resolve("logs"))
            .environment(Map.of());
    }

    @Test
    void defaults() throws IOException {
        AppConfig config = builder().parseArgs(new String[0]).build();
        assertTrue(config.isRefine());
        assertFalse(config.isFresh());
        assertFalse(config.isDevMode());
        assertEquals(0, config.getWorkers());
        assertEquals("ollama", config.getOracle().getProvider());
        assertNull(config.getOracle().getApiKey());
        assertEquals(tempDir.resolve("data").resolve("suggestion-cache.json"), config.getCachePath());
        assertTrue(Files.isDirectory(tempDir.resolve("logs")));
    }

    @Test
    void parsesBothFlagForms() throws IOException {
        AppConfig config = builder().parseArgs(new String[]{
            "--root", tempDir.toString(),
            "--provider=openai",
            "--model", "gpt-4o",
            "--base-url=http://localhost:9999/v1",
            "--workers", "6",
            "--no-refine",
            "--fresh",
            "--dev"
        }).build();

        assertEquals(tempDir.toAbsolutePath().normalize(), config.getRootPath());
        assertEquals("openai", config.getOracle().getProvider());
        assertEquals("gpt-4o", config.getOracle().getModel());
        assertEquals("http://localhost:9999/v1", config.getOracle().getBaseUrl());
        assertEquals(6, config.getWorkers());
        assertFalse(config.isRefine());
        assertTrue(config.isFresh());
        assertTrue(config.isDevMode());
    }

    @Test
    void unknownFlagsAreSkipped() throws IOException {
        AppConfig config = builder().parseArgs(new String[]{"--verbose=2", "--color", "--fresh"}).build();
        assertTrue(config.isFresh());
    }

    @Test
    void badNumberIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> builder().parseArgs(new String[]{"--port", "eighty"}));
        assertTrue(e.getMessage().startsWith("--port"));
    }

    @Test
    void unknownProviderIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> builder().parseArgs(new String[]{"--provider", "gemini"}));
    }

    @Test
    void apiKeyComesFromFlagThenEnvironment() {
        OracleEndpointConfig flag = builder()
            .environment(Map.of("OPENAI_API_KEY", "env-key"))
            .parseArgs(new String[]{"--provider", "openai", "--api-key", "flag-key"})
            .resolveOracle();
        assertEquals("flag-key", flag.getApiKey());

        OracleEndpointConfig shared = builder()
            .environment(Map.of("AUTOSORT_API_KEY", "shared", "XAI_API_KEY", "xai"))
            .parseArgs(new String[]{"--provider", "grok"})
            .resolveOracle();
        assertEquals("shared", shared.getApiKey());

        OracleEndpointConfig grok = builder()
            .environment(Map.of("XAI_API_KEY", "xai", "OPENAI_API_KEY", "openai"))
            .parseArgs(new String[]{"--provider", "xai"})
            .resolveOracle();
        assertEquals("xai", grok.getApiKey());
    }

    @Test
    void localOracleNeverCarriesKey() {
        OracleEndpointConfig local = builder()
            .environment(Map.of("AUTOSORT_API_KEY", "shared"))
            .parseArgs(new String[]{"--provider", "local"})
            .resolveOracle();
        assertNull(local.getApiKey());
    }
}
