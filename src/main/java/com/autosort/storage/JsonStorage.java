package com.autosort.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;

public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static <V> Map<String, V> readJsonMap(Path path, TypeReference<Map<String, V>> type) throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0) {
            return Collections.emptyMap();
        }
        Map<String, V> items = mapper.readValue(path.toFile(), type);
        return items != null ? items : Collections.emptyMap();
    }

    /**
     * Atomic write: write to .tmp file, then rename.
     */
    public static void writeJsonAtomic(Path path, Object data) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmpFile = path.resolveSibling(path.getFileName().toString() + ".tmp");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
        Files.writeString(tmpFile, json, StandardCharsets.UTF_8);
        try {
            Files.move(tmpFile, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmpFile, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
