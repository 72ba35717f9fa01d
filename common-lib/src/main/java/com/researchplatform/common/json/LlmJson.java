package com.researchplatform.common.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates and parses the JSON object inside free-form model output.
 *
 * <p>Models frequently wrap the requested JSON in prose or markdown fences. The outermost
 * {@code {...}} span (first opening brace to last closing brace) is taken as the candidate and
 * parsed with Jackson. Callers pair this with their own fallback value when it returns empty.
 */
public final class LlmJson {

    private static final Logger log = LoggerFactory.getLogger(LlmJson.class);

    private static final Pattern OUTERMOST_OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);

    private LlmJson() {}

    /** The outermost brace-delimited span, if the text contains one. */
    public static Optional<String> outermostObject(String text) {
        if (text == null) return Optional.empty();
        Matcher matcher = OUTERMOST_OBJECT.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    public static boolean containsBraces(String text) {
        return outermostObject(text).isPresent();
    }

    /**
     * Parses the outermost object span. Empty when no span exists, when it is not valid JSON,
     * or when it parses to something other than an object.
     */
    public static Optional<JsonNode> parseObject(String text, ObjectMapper objectMapper) {
        return parseWith(text, objectMapper);
    }

    /**
     * Like {@link #parseObject} but tolerates the slips models commonly make: trailing commas,
     * single quotes, unquoted field names and missing values.
     */
    public static Optional<JsonNode> parseObjectLenient(String text, ObjectMapper objectMapper) {
        ObjectMapper lenient = objectMapper.copy()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature())
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature())
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES.mappedFeature())
            .enable(JsonReadFeature.ALLOW_MISSING_VALUES.mappedFeature());
        return parseWith(text, lenient);
    }

    private static Optional<JsonNode> parseWith(String text, ObjectMapper objectMapper) {
        Optional<String> candidate = outermostObject(text);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(candidate.get());
            if (node == null || !node.isObject()) {
                log.debug("[LlmJson] Candidate span is not a JSON object. span={}", abbreviate(candidate.get()));
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            log.debug("[LlmJson] Candidate span failed to parse. reason={}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static String abbreviate(String text) {
        return text.length() <= 120 ? text : text.substring(0, 120) + "...";
    }
}
