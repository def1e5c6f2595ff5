package com.autosort.storage;

import com.autosort.AppLogger;
import com.autosort.models.FileSignature;
import com.autosort.models.SuggestionRecord;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolved paths keyed by {@link FileSignature}, mirrored to a pretty-printed JSON file
 * ({@code signature -> record}) on every store.
 *
 * <p>Reads come from memory. Writes take a single lock for the in-memory update plus the file
 * rewrite, so concurrent workers never interleave partial files. A failed write is logged and
 * the in-memory entry is kept.
 */
public class SuggestionCache {

    private static final TypeReference<Map<String, SuggestionRecord>> RECORD_MAP =
        new TypeReference<Map<String, SuggestionRecord>>() {};

    private final Path cacheFile;
    private final Map<String, SuggestionRecord> records = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public SuggestionCache(Path cacheFile) {
        this.cacheFile = cacheFile;
        load();
    }

    public Path getCacheFile() {
        return cacheFile;
    }

    public Optional<SuggestionRecord> lookup(FileSignature signature) {
        if (signature == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(signature.value()));
    }

    /**
     * Unconditional overwrite, persisted before returning.
     */
    public void store(FileSignature signature, SuggestionRecord record) {
        if (signature == null || record == null) {
            return;
        }
        record.setSignature(signature.value());
        synchronized (writeLock) {
            records.put(signature.value(), record);
            persist();
        }
    }

    public void invalidateAll() {
        synchronized (writeLock) {
            int count = records.size();
            records.clear();
            try {
                Files.deleteIfExists(cacheFile);
                log("Cleared " + count + " cached suggestions");
            } catch (IOException e) {
                logWarning("Could not delete " + cacheFile + ": " + e.getMessage());
                persist();
            }
        }
    }

    public int size() {
        return records.size();
    }

    private void load() {
        try {
            Map<String, SuggestionRecord> stored = JsonStorage.readJsonMap(cacheFile, RECORD_MAP);
            for (Map.Entry<String, SuggestionRecord> entry : stored.entrySet()) {
                SuggestionRecord record = entry.getValue();
                if (entry.getKey() == null || record == null || record.getResolvedPath() == null) {
                    continue;
                }
                record.setSignature(entry.getKey());
                records.put(entry.getKey(), record);
            }
            if (!records.isEmpty()) {
                log("Loaded " + records.size() + " cached suggestions from " + cacheFile);
            }
        } catch (IOException e) {
            logWarning("Ignoring unreadable cache " + cacheFile + ": " + e.getMessage());
        }
    }

    private void persist() {
        try {
            JsonStorage.writeJsonAtomic(cacheFile, new TreeMap<>(records));
        } catch (IOException e) {
            logWarning("Failed to write " + cacheFile + ": " + e.getMessage());
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[SuggestionCache] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[SuggestionCache] " + message);
        }
    }
}
