package com.autosort.models;

import java.util.Locale;

/**
 * Dominant folder naming style of a tree.
 */
public enum NamingConvention {
    KEBAB_CASE,
    SNAKE_CASE,
    PASCAL_CASE,
    UNKNOWN;

    /**
     * Rewrite one folder name to this convention. Only kebab and snake case rewrite;
     * the other styles return the segment unchanged.
     */
    public String apply(String segment) {
        if (segment == null || segment.isEmpty()) {
            return segment;
        }
        switch (this) {
            case KEBAB_CASE:
                return segment.trim().replaceAll("[_\\s]+", "-").toLowerCase(Locale.ROOT);
            case SNAKE_CASE:
                return segment.trim().replaceAll("[-\\s]+", "_").toLowerCase(Locale.ROOT);
            default:
                return segment;
        }
    }
}
