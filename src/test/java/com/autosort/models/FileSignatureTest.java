package com.autosort.models;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FileSignatureTest {

    @TempDir
    Path tempDir;

    @Test
    void valueIsNameSizeAndSeconds() {
        assertEquals("report.pdf|2048|1700000000", FileSignature.of("report.pdf", 2048, 1700000000L).value());
    }

    @Test
    void independentOfLocation() throws IOException {
        Instant mtime = Instant.parse("2024-01-01T00:00:00Z");
        Path a = Files.writeString(Files.createDirectories(tempDir.resolve("a")).resolve("x.txt"), "same");
        Path b = Files.writeString(Files.createDirectories(tempDir.resolve("b")).resolve("x.txt"), "same");
        Files.setLastModifiedTime(a, FileTime.from(mtime));
        Files.setLastModifiedTime(b, FileTime.from(mtime));
        assertEquals(FileSignature.of(a), FileSignature.of(b));
    }

    @Test
    void changesWithSizeOrModificationTime() throws IOException {
        Path file = Files.writeString(tempDir.resolve("x.txt"), "one");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
        FileSignature before = FileSignature.of(file);

        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-01-02T00:00:00Z")));
        FileSignature touched = FileSignature.of(file);
        assertNotEquals(before, touched);

        Files.writeString(file, "one more");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-01-02T00:00:00Z")));
        assertNotEquals(touched, FileSignature.of(file));
    }

    @Test
    void missingFileStillProducesSignature() {
        assertEquals("ghost.bin|0|0", FileSignature.of(tempDir.resolve("ghost.bin")).value());
    }

    @Test
    void parseRoundTripsAndRejectsBlank() {
        assertEquals(FileSignature.of("a", 1, 2), FileSignature.parse("a|1|2"));
        assertThrows(IllegalArgumentException.class, () -> FileSignature.parse(" "));
    }
}
