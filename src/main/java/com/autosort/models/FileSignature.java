package com.autosort.models;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

/**
 * Lightweight identity of a file's content state: {@code name|size|mtimeSeconds}.
 * Independent of the file's location. Not content-hashed, so distinct files sharing
 * name, size and modification second collide.
 */
public final class FileSignature {

    private final String value;

    private FileSignature(String value) {
        this.value = value;
    }

    public static FileSignature of(String name, long size, long modifiedEpochSeconds) {
        return new FileSignature(name + "|" + size + "|" + modifiedEpochSeconds);
    }

    public static FileSignature of(Path file) {
        String name = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return of(name, attrs.size(), attrs.lastModifiedTime().toInstant().getEpochSecond());
        } catch (IOException e) {
            return of(name, 0, 0);
        }
    }

    public static FileSignature parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("signature value is required");
        }
        return new FileSignature(value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileSignature)) return false;
        return value.equals(((FileSignature) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
