package com.autosort.resolve;

import com.autosort.AppLogger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Snaps generated folder names onto existing sibling folders so near-duplicates
 * ("Docments" next to "Documents") are not created.
 */
public class TaxonomySnapper {

    public static final double DEFAULT_CUTOFF = 0.8;

    private final double cutoff;

    public TaxonomySnapper() {
        this(DEFAULT_CUTOFF);
    }

    public TaxonomySnapper(double cutoff) {
        if (cutoff <= 0 || cutoff > 1) {
            throw new IllegalArgumentException("cutoff must be in (0, 1]: " + cutoff);
        }
        this.cutoff = cutoff;
    }

    public double getCutoff() {
        return cutoff;
    }

    /**
     * Walks the path left to right. A leading segment equal to the root name (any case) is
     * normalized to {@code rootName} and maps to the snapshot root; every later segment is
     * compared against the children of the folder resolved so far.
     */
    public String snap(String path, String rootName, TaxonomySnapshot snapshot) {
        if (path == null || path.isBlank() || snapshot == null) {
            return path;
        }
        List<String> parts = new ArrayList<>();
        for (String part : path.split("/")) {
            if (!part.isBlank()) {
                parts.add(part);
            }
        }
        if (parts.isEmpty()) {
            return path;
        }

        List<String> snapped = new ArrayList<>();
        int start = 0;
        if (rootName != null && parts.get(0).equalsIgnoreCase(rootName)) {
            snapped.add(rootName);
            start = 1;
        }
        Path ancestor = snapshot.getRoot();
        for (String segment : parts.subList(start, parts.size())) {
            String chosen = segment;
            try {
                List<String> siblings = snapshot.childrenOf(ancestor);
                String match = SimilarityScorer.closestMatch(segment, siblings, cutoff);
                if (match != null) {
                    chosen = match;
                }
                ancestor = ancestor.resolve(chosen);
            } catch (RuntimeException e) {
                logWarning("Keeping '" + segment + "' after lookup failure: " + e.getMessage());
            }
            snapped.add(chosen);
        }
        return String.join("/", snapped);
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[TaxonomySnapper] " + message);
        }
    }
}
