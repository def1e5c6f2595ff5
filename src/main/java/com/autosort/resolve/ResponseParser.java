package com.autosort.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a best-effort folder path out of free-form oracle output.
 *
 * <p>Order: a JSON envelope with a {@code path} key wins outright. Otherwise fences, tag blocks
 * and headings are stripped, known lead-in phrases removed, and every path-shaped substring is
 * scored. The best positive candidate wins (first occurrence on ties); failing that, the first
 * short line containing a slash; failing that, the empty string.
 *
 * <p>Never throws. An empty result means "no suggestion".
 */
public class ResponseParser {

    public static final List<String> DEFAULT_LEAD_INS = List.of(
        "the cleaned compact path would be",
        "the path would be",
        "the best path is",
        "the folder path is",
        "the path is",
        "final path",
        "suggested path",
        "this file should go in",
        "this file belongs in",
        "this belongs in",
        "organize this as",
        "suggested organization",
        "recommended location",
        "i would suggest",
        "i suggest",
        "folder path:",
        "path:",
        "folder:",
        "directory:"
    );

    private static final Set<String> STOP_WORDS = Set.of(
        "is", "are", "the", "this", "that", "here", "would", "should", "could");

    private static final Pattern ERROR_MARKER = Pattern.compile(
        "^\\s*(?:(?:openai|grok|xai|ollama)\\s+)?error(?:\\s+after\\b[^:]*)?\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern CODE_FENCE = Pattern.compile("```[A-Za-z0-9_+-]*");
    private static final Pattern REASONING_BLOCK = Pattern.compile(
        "<(think|thinking|reasoning|analysis|reflection)\\b[^>]*>.*?</\\1\\s*>",
        Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern STRAY_TAG = Pattern.compile("</?[A-Za-z][\\w-]*[^>]*>");
    private static final Pattern HEADING = Pattern.compile("(?m)^\\s*#+\\s.*$");
    private static final Pattern PATH_GRAMMAR = Pattern.compile("[A-Za-z0-9 _.-]+(?:/[A-Za-z0-9 _.-]+){0,2}");
    private static final Pattern STRICT_SEGMENT = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");
    private static final Pattern WORD = Pattern.compile("[A-Za-z]+");

    private final ObjectMapper objectMapper;
    private final List<Pattern> leadIns;

    public ResponseParser(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_LEAD_INS);
    }

    public ResponseParser(ObjectMapper objectMapper, List<String> leadInPhrases) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.leadIns = compileLeadIns(leadInPhrases != null ? leadInPhrases : DEFAULT_LEAD_INS);
    }

    /**
     * True when the oracle reported a failure instead of answering ("Error: ...",
     * "OpenAI Error: ...", "Error after 4 attempts: ...").
     */
    public static boolean isErrorResponse(String raw) {
        return raw != null && ERROR_MARKER.matcher(raw).find();
    }

    public String parse(String raw) {
        try {
            return parseInternal(raw);
        } catch (RuntimeException e) {
            return "";
        }
    }

    private String parseInternal(String raw) {
        if (raw == null || raw.isBlank() || isErrorResponse(raw)) {
            return "";
        }

        String fromJson = extractJsonPath(raw);
        if (fromJson != null) {
            return fromJson;
        }

        String text = CODE_FENCE.matcher(raw).replaceAll("\n");
        text = REASONING_BLOCK.matcher(text).replaceAll("\n");
        text = STRAY_TAG.matcher(text).replaceAll(" ");
        text = HEADING.matcher(text).replaceAll("");
        for (Pattern leadIn : leadIns) {
            text = leadIn.matcher(text).replaceAll("\n");
        }

        PathCandidate best = null;
        Matcher m = PATH_GRAMMAR.matcher(text);
        while (m.find()) {
            for (String candidate : expand(m.group())) {
                int score = score(candidate);
                if (best == null || score > best.getScore()) {
                    best = new PathCandidate(candidate, score);
                }
            }
        }
        if (best != null && best.getScore() > 0) {
            return best.getText();
        }

        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.contains("/") && trimmed.length() < 50) {
                return trimmed;
            }
        }
        return "";
    }

    /**
     * The grammar match itself, plus its slash-bearing words when the match reads like a
     * sentence ("I think Docs/Images is best").
     */
    private List<String> expand(String match) {
        List<String> out = new ArrayList<>();
        String whole = clean(match);
        if (whole.isEmpty()) {
            return out;
        }
        out.add(whole);
        if (looksLikeProse(whole)) {
            for (String token : whole.split("\\s+")) {
                String cleaned = clean(token);
                if (cleaned.contains("/") && !cleaned.equals(whole)) {
                    out.add(cleaned);
                }
            }
        }
        return out;
    }

    private static String clean(String candidate) {
        String c = candidate.trim();
        while (c.endsWith(".") || c.endsWith("/")) {
            c = c.substring(0, c.length() - 1).trim();
        }
        if (c.startsWith("./")) {
            c = c.substring(2).trim();
        }
        if (c.chars().allMatch(ch -> ch == '.' || ch == '/' || ch == ' ')) {
            return "";
        }
        return c;
    }

    private static boolean looksLikeProse(String candidate) {
        int words = 0;
        Matcher w = WORD.matcher(candidate);
        while (w.find()) {
            words++;
            if (STOP_WORDS.contains(w.group().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return words > 6;
    }

    static int score(String candidate) {
        int score = 0;
        if (candidate.contains("/")) {
            score += 10;
        }
        score += Math.max(0, 20 - candidate.length());

        int words = 0;
        Matcher w = WORD.matcher(candidate);
        while (w.find()) {
            words++;
            if (STOP_WORDS.contains(w.group().toLowerCase(Locale.ROOT))) {
                score -= 2;
            }
        }
        if (words > 6) {
            score -= (words - 6) * 2;
        }

        boolean strict = true;
        for (String segment : candidate.split("/", -1)) {
            if (!STRICT_SEGMENT.matcher(segment).matches()) {
                strict = false;
                break;
            }
        }
        if (strict) {
            score += 5;
        }
        return score;
    }

    /**
     * Looks for a JSON object carrying a {@code path} key (any case). Scans every balanced
     * {@code {...}} span so envelopes embedded in prose are found too.
     */
    private String extractJsonPath(String raw) {
        int start = raw.indexOf('{');
        while (start >= 0) {
            int end = findObjectEnd(raw, start);
            if (end < 0) {
                return null;
            }
            String path = readPathKey(raw.substring(start, end + 1));
            if (path != null) {
                return path;
            }
            start = raw.indexOf('{', start + 1);
        }
        return null;
    }

    private String readPathKey(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (Exception e) {
            return null;
        }
        if (node == null || !node.isObject()) {
            return null;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if ("path".equalsIgnoreCase(field.getKey()) && field.getValue().isTextual()) {
                String value = field.getValue().asText().trim();
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    private int findObjectEnd(String text, int start) {
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static List<Pattern> compileLeadIns(List<String> phrases) {
        List<Pattern> patterns = new ArrayList<>();
        for (String phrase : phrases) {
            if (phrase == null || phrase.isBlank()) {
                continue;
            }
            // A phrase ending in a colon is a label and only matches with its colon.
            String trimmed = phrase.trim();
            boolean label = trimmed.endsWith(":");
            String words = label ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
            String body = Pattern.quote(words).replace(" ", "\\E\\s+\\Q");
            String tail = label ? "\\s*:" : "\\b\\s*:?";
            patterns.add(Pattern.compile("\\b" + body + tail, Pattern.CASE_INSENSITIVE));
        }
        return patterns;
    }
}
