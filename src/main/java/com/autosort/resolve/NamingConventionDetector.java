package com.autosort.resolve;

import com.autosort.models.NamingConvention;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Finds the dominant folder naming style. Plain lowercase names count as kebab-case,
 * lowercase names with underscores as snake_case.
 */
public final class NamingConventionDetector {

    private static final Pattern KEBAB = Pattern.compile("^[a-z]+[a-z0-9-]*$");
    private static final Pattern PASCAL = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");
    private static final Pattern SNAKE = Pattern.compile("^[a-z][a-z0-9_]*$");

    private NamingConventionDetector() {
    }

    public static NamingConvention detect(Collection<String> directoryNames) {
        if (directoryNames == null || directoryNames.isEmpty()) {
            return NamingConvention.UNKNOWN;
        }
        Map<NamingConvention, Integer> counts = new EnumMap<>(NamingConvention.class);
        for (String name : directoryNames) {
            NamingConvention style = classify(name);
            if (style != NamingConvention.UNKNOWN) {
                counts.merge(style, 1, Integer::sum);
            }
        }
        NamingConvention dominant = NamingConvention.UNKNOWN;
        int max = 0;
        for (NamingConvention style : new NamingConvention[] {
            NamingConvention.KEBAB_CASE, NamingConvention.PASCAL_CASE, NamingConvention.SNAKE_CASE}) {
            int count = counts.getOrDefault(style, 0);
            if (count > max) {
                max = count;
                dominant = style;
            }
        }
        return dominant;
    }

    static NamingConvention classify(String name) {
        if (name == null) {
            return NamingConvention.UNKNOWN;
        }
        if (KEBAB.matcher(name).matches()) {
            return NamingConvention.KEBAB_CASE;
        }
        if (PASCAL.matcher(name).matches()) {
            return NamingConvention.PASCAL_CASE;
        }
        if (SNAKE.matcher(name).matches()) {
            return NamingConvention.SNAKE_CASE;
        }
        return NamingConvention.UNKNOWN;
    }
}
