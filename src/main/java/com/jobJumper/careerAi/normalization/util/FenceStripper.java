package com.jobJumper.careerAi.normalization.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for cleaning model prose before it reaches a rendering surface.
 *
 * Handles:
 * - Markdown code-fence markers (```json, ```)
 * - Conversational preamble ("Here is...:", "Sure, ...:")
 * - Emphasis markers (**x**, __x__, *x*, _x_) - enclosed text is kept
 * - "-" / "*" list markers at line start, rewritten to a uniform "• " bullet
 *
 * Both entry points are idempotent and never throw; null input yields an empty string.
 */
public class FenceStripper {

    public static final String BULLET = "•";

    private static final Pattern CODE_FENCE = Pattern.compile("```[A-Za-z0-9_+-]*");

    /**
     * Leading conversational opener, up to and including the first following colon.
     */
    private static final Pattern PREAMBLE = Pattern.compile(
            "^\\s*(?:here is|here's the|sure,|i have rewritten|the improved version|below is)[^:\\n]*:\\s*",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LIST_MARKER = Pattern.compile("(?m)^[ \\t]*[-*][ \\t]+");

    private static final Pattern BOLD_ASTERISK = Pattern.compile("\\*\\*(?=\\S)([^\\n]*?\\S)\\*\\*");

    private static final Pattern BOLD_UNDERSCORE = Pattern.compile("__(?=\\S)([^\\n]*?\\S)__");

    // A lone '*' next to another '*' belongs to a bold marker and is left for BOLD_ASTERISK.
    private static final Pattern ITALIC_ASTERISK = Pattern.compile("(?<!\\*)\\*(?=[^\\s*])([^*\\n]*?[^\\s*])\\*(?!\\*)");

    // Word-delimited so identifiers like snake_case_name survive.
    private static final Pattern ITALIC_UNDERSCORE = Pattern.compile("(?<![\\w_])_(?=[^\\s_])([^_\\n]*?[^\\s_])_(?![\\w_])");

    private FenceStripper() {}

    /**
     * Removes code fences, then applies {@link #cleanText(String)}.
     *
     * @param text Raw model text, may be null
     * @return Cleaned text, never null
     */
    public static String strip(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String current = text;
        while (true) {
            String next = cleanText(CODE_FENCE.matcher(current).replaceAll(""));
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
    }

    /**
     * Applies preamble, bullet and emphasis cleanup without touching code fences.
     * Used for individual string leaves of an already located JSON value.
     *
     * @param text Text to clean, may be null
     * @return Cleaned text, never null
     */
    public static String cleanText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        // Every pass shortens the text or leaves it stable, so the loop terminates.
        String current = text;
        while (true) {
            String next = cleanOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
    }

    private static String cleanOnce(String text) {
        String result = removePreamble(text);
        result = LIST_MARKER.matcher(result).replaceAll(BULLET + " ");
        result = replaceKeepingGroup(BOLD_ASTERISK, result);
        result = replaceKeepingGroup(BOLD_UNDERSCORE, result);
        result = replaceKeepingGroup(ITALIC_ASTERISK, result);
        result = replaceKeepingGroup(ITALIC_UNDERSCORE, result);
        return result.trim();
    }

    private static String removePreamble(String text) {
        String result = text;
        Matcher matcher = PREAMBLE.matcher(result);
        while (matcher.find()) {
            result = result.substring(matcher.end());
            matcher = PREAMBLE.matcher(result);
        }
        return result;
    }

    private static String replaceKeepingGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
