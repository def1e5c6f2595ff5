package com.autosort.oracle;

import com.autosort.models.PromptContext;
import com.autosort.resolve.ResponseParser;

import java.io.IOException;

/**
 * Reachability check: one suggestion for a canned file. Never throws.
 */
public final class OracleStatus {

    private final boolean available;
    private final String message;

    private OracleStatus(boolean available, String message) {
        this.available = available;
        this.message = message;
    }

    public static OracleStatus check(Oracle oracle) {
        PromptContext sample = PromptContext.builder()
            .rootName("Root")
            .fileName("test_document.pdf")
            .extension(".pdf")
            .category("docs")
            .fileHint("Type=Doc; Name=test_document.pdf; Parent=Root; Ancestors=Root")
            .build();
        try {
            String raw = oracle.suggest(sample);
            if (raw == null || raw.isBlank() || ResponseParser.isErrorResponse(raw)) {
                return new OracleStatus(false, raw == null || raw.isBlank() ? "Empty response" : raw.trim());
            }
            return new OracleStatus(true, oracle.getKind().getProviderName() + " responded: " + raw.trim());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new OracleStatus(false, "Interrupted");
        } catch (IOException | RuntimeException e) {
            return new OracleStatus(false, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    public boolean isAvailable() {
        return available;
    }

    public String getMessage() {
        return message;
    }
}
