package com.autosort.resolve;

import com.autosort.models.ResolutionOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes a raw path string into a bounded, filesystem-safe relative path of at most
 * {@value #MAX_SEGMENTS} segments. Never returns an empty string; anything unusable becomes
 * the sentinel. Idempotent: {@code sanitize(sanitize(x)).equals(sanitize(x))}.
 */
public final class PathSanitizer {

    public static final int MAX_SEGMENTS = 3;
    public static final int MAX_TOTAL_LENGTH = 200;
    public static final int MAX_SEGMENT_LENGTH = 50;

    private static final Set<String> REJECTED = Set.of("error", "none", "null", "undefined", "unknown");
    private static final String INVALID_CHARS = "<>:\"|?*";
    private static final String QUOTES = "\"'`";
    private static final List<String> PREFIXES = List.of(
        "suggested path:",
        "suggested folder:",
        "folder path:",
        "final path:",
        "directory:",
        "folder:",
        "path:"
    );

    private final String sentinel;

    public PathSanitizer() {
        this(ResolutionOutcome.SENTINEL);
    }

    public PathSanitizer(String sentinel) {
        if (sentinel == null || sentinel.isBlank()) {
            throw new IllegalArgumentException("sentinel is required");
        }
        this.sentinel = sentinel;
    }

    public String getSentinel() {
        return sentinel;
    }

    public boolean isSentinel(String path) {
        return path != null && sentinel.equalsIgnoreCase(path.trim());
    }

    public String sanitize(String raw) {
        String current = sanitizeOnce(raw);
        // Passes only delete characters or turn backslashes into slashes, and the sentinel is
        // a fixed point, so this loop ends.
        while (true) {
            String next = sanitizeOnce(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    private String sanitizeOnce(String raw) {
        if (raw == null || isRejected(raw)) {
            return sentinel;
        }
        String path = stripQuotePairs(firstLine(raw).trim());
        path = path.replace('\\', '/');
        path = stripSlashes(path);
        path = stripPrefix(path);
        path = deleteInvalidChars(path);

        List<String> segments = new ArrayList<>();
        for (String part : path.split("/")) {
            String segment = part.trim().replaceAll("\\s+", " ");
            if (segment.isEmpty() || segment.chars().allMatch(c -> c == '.')) {
                continue;
            }
            if (segments.size() == MAX_SEGMENTS) {
                break;
            }
            segments.add(segment);
        }
        if (segments.isEmpty()) {
            return sentinel;
        }
        int total = segments.size() - 1;
        for (String segment : segments) {
            if (segment.length() > MAX_SEGMENT_LENGTH) {
                return sentinel;
            }
            total += segment.length();
        }
        if (total > MAX_TOTAL_LENGTH) {
            return sentinel;
        }
        String joined = String.join("/", segments);
        return isRejected(joined) ? sentinel : joined;
    }

    private boolean isRejected(String value) {
        String folded = value.trim().toLowerCase(Locale.ROOT);
        return folded.isEmpty() || REJECTED.contains(folded);
    }

    private String firstLine(String value) {
        for (String line : value.split("\\R")) {
            if (!line.isBlank()) {
                return line;
            }
        }
        return value;
    }

    private String stripQuotePairs(String value) {
        String current = value;
        while (current.length() >= 2) {
            char first = current.charAt(0);
            char last = current.charAt(current.length() - 1);
            if (first != last || QUOTES.indexOf(first) < 0) {
                break;
            }
            current = current.substring(1, current.length() - 1).trim();
        }
        return current;
    }

    private String stripSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end).trim();
    }

    /**
     * Prefixes all carry a colon, which is an invalid character, so a prefix can only be
     * stripped once per input.
     */
    private String stripPrefix(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String prefix : PREFIXES) {
            if (lower.startsWith(prefix)) {
                return stripSlashes(value.substring(prefix.length()).trim());
            }
        }
        return value;
    }

    private String deleteInvalidChars(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (INVALID_CHARS.indexOf(c) < 0 && !Character.isISOControl(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
