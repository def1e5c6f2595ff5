package com.autosort;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide resolver log. Lines go to the log file and, in dev mode, to stdout.
 * Resolver workers write concurrently, so every write holds the instance lock.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private static volatile AppLogger instance;

    private final PrintStream file;
    private final boolean echo;

    AppLogger(Path logFile, boolean echo) throws IOException {
        Path parent = logFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.file = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8);
        this.echo = echo;
    }

    public static synchronized void initialize(Path logFile, boolean echo) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, echo);
        }
    }

    /**
     * Null until {@link #initialize} runs, which is the case in unit tests.
     */
    public static AppLogger get() {
        return instance;
    }

    public void info(String message) {
        write("INFO", message);
    }

    public void warn(String message) {
        write("WARN", message);
    }

    public synchronized void error(String message, Throwable t) {
        write("ERROR", message);
        t.printStackTrace(file);
        if (echo) {
            t.printStackTrace(System.err);
        }
    }

    /**
     * Operator-facing startup lines: always printed to stdout, copied to the log without a prefix.
     */
    public synchronized void announce(String... lines) {
        for (String line : lines) {
            System.out.println(line);
            file.println(line);
        }
    }

    public synchronized void close() {
        file.close();
    }

    private synchronized void write(String level, String message) {
        String line = LocalDateTime.now().format(TIME_FORMAT) + " " + String.format("%-5s", level)
            + " (" + Thread.currentThread().getName() + ") " + message;
        file.println(line);
        if (echo) {
            System.out.println(line);
        }
    }
}
