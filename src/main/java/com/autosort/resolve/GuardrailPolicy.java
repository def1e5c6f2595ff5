package com.autosort.resolve;

import com.autosort.models.GuardrailContext;
import com.autosort.models.NamingConvention;
import com.autosort.models.PinRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Organization-wide rules applied to every sanitized suggestion, in priority order:
 * <ol>
 *   <li>pin rules replace the suggestion outright and stop evaluation;</li>
 *   <li>root containment prepends the root folder when missing;</li>
 *   <li>naming-convention rewrite (kebab/snake) of the non-root segments;</li>
 *   <li>alias substitution when a conventional folder is missing but a synonym exists.</li>
 * </ol>
 * The result is never empty and never longer than {@link PathSanitizer#MAX_SEGMENTS} segments.
 */
public class GuardrailPolicy {

    static final Map<String, List<String>> ALIASES = buildAliases();

    private final PathSanitizer sanitizer;

    public GuardrailPolicy(PathSanitizer sanitizer) {
        this.sanitizer = sanitizer != null ? sanitizer : new PathSanitizer();
    }

    public GuardrailDecision apply(String fileName, String sanitizedPath, GuardrailContext context,
                                   TaxonomySnapshot snapshot) {
        PinRule pin = context.findPin(fileName);
        if (pin != null) {
            List<String> pinned = new ArrayList<>();
            pinned.add(context.getRootName());
            pinned.addAll(split(pin.getSubpath()));
            return GuardrailDecision.pinned(join(cap(pinned)), pin.getName());
        }

        List<String> parts = split(sanitizedPath);
        if (parts.isEmpty()) {
            parts.add(sanitizer.getSentinel());
        }

        boolean rooted = parts.get(0).equalsIgnoreCase(context.getRootName());
        if (context.isStayUnderRoot() && !rooted) {
            parts.add(0, context.getRootName());
            parts = cap(parts);
            rooted = true;
        }
        int first = rooted ? 1 : 0;

        NamingConvention convention = context.getNamingConvention();
        if (convention == NamingConvention.KEBAB_CASE || convention == NamingConvention.SNAKE_CASE) {
            for (int i = first; i < parts.size(); i++) {
                if (!sanitizer.isSentinel(parts.get(i))) {
                    parts.set(i, convention.apply(parts.get(i)));
                }
            }
        }

        if (context.isSubstituteAliases() && snapshot != null && parts.size() > first) {
            parts.set(first, substituteAlias(parts.get(first), snapshot.childrenOf(snapshot.getRoot())));
        }

        return GuardrailDecision.guarded(join(parts));
    }

    static String substituteAlias(String segment, List<String> existing) {
        List<String> synonyms = ALIASES.get(segment.toLowerCase(Locale.ROOT));
        if (synonyms == null || containsIgnoreCase(existing, segment)) {
            return segment;
        }
        for (String synonym : synonyms) {
            for (String name : existing) {
                if (name.equalsIgnoreCase(synonym)) {
                    return name;
                }
            }
        }
        return segment;
    }

    private static boolean containsIgnoreCase(List<String> names, String value) {
        for (String name : names) {
            if (name.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> split(String path) {
        List<String> parts = new ArrayList<>();
        if (path == null) {
            return parts;
        }
        for (String part : path.split("/")) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts;
    }

    private static List<String> cap(List<String> parts) {
        if (parts.size() <= PathSanitizer.MAX_SEGMENTS) {
            return parts;
        }
        return new ArrayList<>(parts.subList(0, PathSanitizer.MAX_SEGMENTS));
    }

    private static String join(List<String> parts) {
        return String.join("/", parts);
    }

    private static Map<String, List<String>> buildAliases() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("src", List.of("app", "lib", "source"));
        map.put("docs", List.of("doc", "documentation"));
        map.put("tests", List.of("test", "spec"));
        map.put("config", List.of("conf", "settings", "cfg"));
        map.put("assets", List.of("static", "public", "media"));
        return Collections.unmodifiableMap(map);
    }
}
