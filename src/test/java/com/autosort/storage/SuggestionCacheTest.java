package com.autosort.storage;

import com.autosort.models.FileSignature;
import com.autosort.models.SuggestionRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class SuggestionCacheTest {

    @TempDir
    Path tempDir;

    private SuggestionRecord record(String path) {
        return new SuggestionRecord(null, path, "/scan/Root/a.pdf", 1700000000000L, Map.of("summary", "docs"));
    }

    @Test
    void storeThenLookup() {
        SuggestionCache cache = new SuggestionCache(tempDir.resolve("cache.json"));
        FileSignature sig = FileSignature.of("a.pdf", 10, 100);
        assertTrue(cache.lookup(sig).isEmpty());

        cache.store(sig, record("Root/Docs"));
        Optional<SuggestionRecord> found = cache.lookup(sig);
        assertTrue(found.isPresent());
        assertEquals("Root/Docs", found.get().getResolvedPath());
        assertEquals("a.pdf|10|100", found.get().getSignature());
    }

    @Test
    void storeOverwrites() {
        SuggestionCache cache = new SuggestionCache(tempDir.resolve("cache.json"));
        FileSignature sig = FileSignature.of("a.pdf", 10, 100);
        cache.store(sig, record("Root/Docs"));
        cache.store(sig, record("Root/Finance"));
        assertEquals("Root/Finance", cache.lookup(sig).get().getResolvedPath());
        assertEquals(1, cache.size());
    }

    @Test
    void changedFileMisses() {
        SuggestionCache cache = new SuggestionCache(tempDir.resolve("cache.json"));
        cache.store(FileSignature.of("a.pdf", 10, 100), record("Root/Docs"));
        assertTrue(cache.lookup(FileSignature.of("a.pdf", 11, 100)).isEmpty());
        assertTrue(cache.lookup(FileSignature.of("a.pdf", 10, 101)).isEmpty());
    }

    @Test
    void persistsReadableJsonImmediately() throws IOException {
        Path file = tempDir.resolve("nested").resolve("cache.json");
        SuggestionCache cache = new SuggestionCache(file);
        cache.store(FileSignature.of("a.pdf", 10, 100), record("Root/Docs"));

        JsonNode stored = new ObjectMapper().readTree(file.toFile());
        assertEquals("Root/Docs", stored.path("a.pdf|10|100").path("resolvedPath").asText());
        assertEquals("docs", stored.path("a.pdf|10|100").path("contextSnapshot").path("summary").asText());
        assertFalse(Files.exists(tempDir.resolve("nested").resolve("cache.json.tmp")));
    }

    @Test
    void reloadsFromDisk() {
        Path file = tempDir.resolve("cache.json");
        new SuggestionCache(file).store(FileSignature.of("a.pdf", 10, 100), record("Root/Docs"));

        SuggestionCache reopened = new SuggestionCache(file);
        assertEquals("Root/Docs", reopened.lookup(FileSignature.of("a.pdf", 10, 100)).get().getResolvedPath());
    }

    @Test
    void corruptFileStartsEmpty() throws IOException {
        Path file = tempDir.resolve("cache.json");
        Files.writeString(file, "{ not json");
        SuggestionCache cache = new SuggestionCache(file);
        assertEquals(0, cache.size());
        cache.store(FileSignature.of("a.pdf", 10, 100), record("Root/Docs"));
        assertEquals(1, new SuggestionCache(file).size());
    }

    @Test
    void invalidateAllClearsMemoryAndDisk() {
        Path file = tempDir.resolve("cache.json");
        SuggestionCache cache = new SuggestionCache(file);
        cache.store(FileSignature.of("a.pdf", 10, 100), record("Root/Docs"));
        cache.invalidateAll();

        assertEquals(0, cache.size());
        assertFalse(Files.exists(file));
        assertEquals(0, new SuggestionCache(file).size());
    }

    @Test
    void writeFailureKeepsInMemoryEntry() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");
        SuggestionCache cache = new SuggestionCache(blocker.resolve("cache.json"));
        FileSignature sig = FileSignature.of("a.pdf", 10, 100);
        cache.store(sig, record("Root/Docs"));
        assertEquals("Root/Docs", cache.lookup(sig).get().getResolvedPath());
    }

    @Test
    void concurrentWritersLeaveValidFile() throws Exception {
        Path file = tempDir.resolve("cache.json");
        SuggestionCache cache = new SuggestionCache(file);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 64; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    cache.store(FileSignature.of("f" + n + ".txt", n, n), record("Root/Bucket" + (n % 4)));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(64, cache.size());
        SuggestionCache reopened = new SuggestionCache(file);
        assertEquals(64, reopened.size());
        assertEquals("Root/Bucket3", reopened.lookup(FileSignature.of("f7.txt", 7, 7)).get().getResolvedPath());
    }
}
