package com.autosort.storage;

import com.autosort.AppLogger;
import com.autosort.models.GuardrailSettings;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class GuardrailConfigStore {
    private final ObjectMapper objectMapper;
    private Path configPath;

    public GuardrailConfigStore(Path scanRoot, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        configure(scanRoot);
    }

    public void configure(Path scanRoot) {
        this.configPath = scanRoot.resolve(".autosort").resolve("guardrails.json");
    }

    public Path getConfigPath() {
        return configPath;
    }

    public GuardrailSettings loadOrDefault() {
        GuardrailSettings defaults = new GuardrailSettings();
        if (configPath == null || !Files.exists(configPath)) {
            return defaults;
        }
        try {
            GuardrailSettings loaded = objectMapper.readValue(configPath.toFile(), GuardrailSettings.class);
            if (loaded == null) {
                return defaults;
            }
            if (loaded.getSnapCutoff() <= 0 || loaded.getSnapCutoff() > 1) {
                logWarning("snapCutoff " + loaded.getSnapCutoff() + " out of range, using " + defaults.getSnapCutoff());
                loaded.setSnapCutoff(defaults.getSnapCutoff());
            }
            if (loaded.getPinnedRules() == null) {
                loaded.setPinnedRules(defaults.getPinnedRules());
            }
            return loaded;
        } catch (IOException e) {
            logWarning("Ignoring unreadable " + configPath + ": " + e.getMessage());
            return defaults;
        }
    }

    public void save(GuardrailSettings settings) throws IOException {
        if (configPath == null || settings == null) {
            return;
        }
        Files.createDirectories(configPath.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(configPath.toFile(), settings);
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[GuardrailConfigStore] " + message);
        }
    }
}
