package com.jobJumper.careerAi.normalization.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Finds and parses the JSON object embedded in raw model text.
 *
 * Models wrap their JSON in prose, fence markers or both. The locator removes fence
 * markers, then walks '{' characters as candidate starts and scans forward to the
 * balanced closing brace, tracking string state and escapes so braces inside string
 * values do not break the match. The first candidate span that parses as a JSON object
 * is returned. A rejected span is never entered again: later candidates start after it,
 * and an unclosed span ends the search, so a nested sub-object of a truncated record
 * is never mistaken for the record.
 */
@Slf4j
@Component
public class JsonLocator {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?", Pattern.CASE_INSENSITIVE);

    /**
     * Upper bound on candidate starts tried per input.
     */
    private static final int MAX_CANDIDATES = 32;

    /**
     * Lenient mapper that tolerates trailing commas, comments, single quotes
     * and unquoted field names.
     */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build();

    /**
     * Locates the JSON object in the given text.
     *
     * @param text Raw model text, may be null
     * @return Found value or an UNPARSABLE result; never throws
     */
    public LocateResult locate(String text) {
        if (text == null || text.isBlank()) {
            return LocateResult.unparsable("empty response text");
        }

        String cleaned = CODE_FENCE.matcher(text).replaceAll("");
        int start = cleaned.indexOf('{');
        if (start < 0) {
            return LocateResult.unparsable("no '{' found in response text");
        }

        String lastError = "no balanced object span";
        int attempts = 0;
        while (start >= 0 && attempts < MAX_CANDIDATES) {
            attempts++;
            int end = findBalancedEnd(cleaned, start);
            if (end < 0) {
                // Unclosed (e.g. truncated output): braces nested inside it are never records.
                lastError = "object starting at offset " + start + " never closes";
                break;
            }
            String candidate = cleaned.substring(start, end + 1);
            try {
                JsonNode node = LENIENT_MAPPER.readTree(candidate);
                if (node != null && node.isObject()) {
                    log.debug("Located JSON object - offset: {}, length: {}, attempts: {}",
                            start, candidate.length(), attempts);
                    return LocateResult.found(node);
                }
                lastError = "candidate span is not a JSON object";
            } catch (JsonProcessingException e) {
                lastError = e.getOriginalMessage();
            } catch (RuntimeException e) {
                // StreamConstraintsException and friends on pathological input
                lastError = e.getMessage();
            }
            // Next candidate must lie outside the span just rejected.
            start = cleaned.indexOf('{', end + 1);
        }

        log.debug("No parsable JSON object in response text - attempts: {}, lastError: {}", attempts, lastError);
        return LocateResult.unparsable(lastError);
    }

    /**
     * Scans forward from an opening brace to its balanced closing brace.
     *
     * @param text Text to scan
     * @param start Index of the opening '{'
     * @return Index of the matching '}', or -1 if the span never closes
     */
    static int findBalancedEnd(String text, int start) {
        int depth = 0;
        char quote = 0;
        boolean escaped = false;

        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '{' -> depth++;
                case '}' -> {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
                default -> {
                    // not structural
                }
            }
        }
        return -1;
    }
}
