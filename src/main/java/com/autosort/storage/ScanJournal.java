package com.autosort.storage;

import com.autosort.AppLogger;
import com.autosort.models.ResolutionStatus;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * JSON-lines record of every resolution made during one scan. Appends are serialized;
 * failures are logged and otherwise ignored.
 */
public class ScanJournal {
    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS")
        .withLocale(Locale.US)
        .withZone(ZoneOffset.UTC);
    private static final int MAX_RAW_CHARS = 500;

    private final ObjectMapper objectMapper;
    private final Path journalFile;
    private final Object lock = new Object();

    public ScanJournal(Path journalFile, ObjectMapper objectMapper) {
        this.journalFile = journalFile;
        this.objectMapper = objectMapper;
    }

    /**
     * New journal under {@code dataDir/scans}, named after the current time.
     */
    public static ScanJournal forScan(Path dataDir, ObjectMapper objectMapper) {
        String name = "scan_" + FILE_TS.format(Instant.now()) + ".jsonl";
        return new ScanJournal(dataDir.resolve("scans").resolve(name), objectMapper);
    }

    public Path getJournalFile() {
        return journalFile;
    }

    public void append(Path source, String hint, String firstPath, String finalPath,
                       ResolutionStatus status, String rawResponse) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("ts", System.currentTimeMillis());
        entry.put("source", source != null ? source.toString() : null);
        entry.put("hint", hint);
        entry.put("firstPath", firstPath);
        entry.put("finalPath", finalPath);
        entry.put("status", status != null ? status.getLabel() : null);
        entry.put("rawResponse", excerpt(rawResponse));
        synchronized (lock) {
            try {
                Files.createDirectories(journalFile.getParent());
                try (BufferedWriter writer = Files.newBufferedWriter(
                    journalFile,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND
                )) {
                    writer.write(objectMapper.writeValueAsString(entry));
                    writer.newLine();
                }
            } catch (IOException e) {
                AppLogger logger = AppLogger.get();
                if (logger != null) {
                    logger.warn("[ScanJournal] Append failed for " + journalFile + ": " + e.getMessage());
                }
            }
        }
    }

    private static String excerpt(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.length() <= MAX_RAW_CHARS ? raw : raw.substring(0, MAX_RAW_CHARS) + "...";
    }
}
