package com.researchplatform.orchestrator.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.common.json.LlmJson;
import com.researchplatform.common.model.Intent;
import com.researchplatform.common.model.ScanIntent;
import com.researchplatform.common.model.TimeRange;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the extractor model's reply into an {@link Intent}.
 *
 * <p>{@link #decodeStructured} handles the requested JSON form. A reply that has braces but does
 * not decode strictly goes to {@link #decodeLenient}; {@link #heuristic} is applied only when the
 * model ignored the format and sent no JSON at all.
 */
public final class IntentDecoder {

    private static final Pattern BARE_SYMBOL = Pattern.compile("[A-Z]{1,5}");
    private static final String[] SCAN_KEYWORDS = {"SCAN", "GAINERS", "LOSERS"};
    private static final Pattern SYMBOL_FIELD =
        Pattern.compile("[\"']?symbol[\"']?\\s*:\\s*[\"']?\\$?([A-Za-z.]{1,10})");
    private static final Pattern RANGE_FIELD =
        Pattern.compile("[\"']?time_range[\"']?\\s*:\\s*[\"']?([A-Za-z0-9]{1,10})");

    private IntentDecoder() {}

    /**
     * Parses the outermost JSON object. Empty when there is none or its {@code scan_intent}
     * holds an unknown value.
     */
    public static Optional<Intent> decodeStructured(String text, ObjectMapper objectMapper) {
        Optional<JsonNode> parsed = LlmJson.parseObject(text, objectMapper);
        if (parsed.isEmpty()) return Optional.empty();
        JsonNode root = parsed.get();

        String symbol = normalizeSymbol(textOrNull(root, "symbol"));

        ScanIntent scanIntent = null;
        String rawScan = textOrNull(root, "scan_intent");
        if (rawScan != null && !isNone(rawScan)) {
            Optional<ScanIntent> decoded = ScanIntent.fromCode(rawScan);
            if (decoded.isEmpty()) return Optional.empty();
            scanIntent = decoded.get();
        }

        TimeRange timeRange = TimeRange.fromCode(textOrNull(root, "time_range")).orElse(TimeRange.INTRADAY);
        return Optional.of(new Intent(symbol, scanIntent, timeRange));
    }

    /**
     * Best-effort decode of a reply whose JSON is malformed. An unknown {@code scan_intent} is
     * dropped rather than guessed. When the span cannot be parsed even leniently, the
     * {@code symbol} and {@code time_range} values are read straight from the text. Never
     * consults the scan keywords, since the field names themselves contain them.
     */
    public static Intent decodeLenient(String text, ObjectMapper objectMapper) {
        Optional<JsonNode> parsed = LlmJson.parseObjectLenient(text, objectMapper);
        if (parsed.isPresent()) {
            JsonNode root = parsed.get();
            String rawScan = textOrNull(root, "scan_intent");
            ScanIntent scanIntent = rawScan == null || isNone(rawScan)
                ? null
                : ScanIntent.fromCode(rawScan).orElse(null);
            return new Intent(normalizeSymbol(textOrNull(root, "symbol")), scanIntent,
                TimeRange.fromCode(textOrNull(root, "time_range")).orElse(TimeRange.INTRADAY));
        }
        if (text == null) return Intent.none();
        String symbol = normalizeSymbol(firstGroup(SYMBOL_FIELD, text));
        TimeRange timeRange = TimeRange.fromCode(firstGroup(RANGE_FIELD, text)).orElse(TimeRange.INTRADAY);
        return symbol == null ? Intent.none() : Intent.forSymbol(symbol, timeRange);
    }

    /**
     * Keyword fallback: scan words give an ALL scan; a bare 1-5 letter token (other than NONE)
     * is a symbol; anything else is the empty intent.
     */
    public static Intent heuristic(String text) {
        if (text == null) return Intent.none();
        String upper = text.trim().toUpperCase(Locale.ROOT);
        for (String keyword : SCAN_KEYWORDS) {
            if (upper.contains(keyword)) {
                return Intent.forScan(ScanIntent.ALL, TimeRange.INTRADAY);
            }
        }
        String token = stripDollar(upper);
        if (BARE_SYMBOL.matcher(token).matches() && !"NONE".equals(token)) {
            return Intent.forSymbol(token, TimeRange.INTRADAY);
        }
        return Intent.none();
    }

    static String normalizeSymbol(String raw) {
        if (raw == null) return null;
        String symbol = stripDollar(raw.trim().toUpperCase(Locale.ROOT));
        return symbol.isEmpty() || isNone(symbol) ? null : symbol;
    }

    private static String stripDollar(String value) {
        return value.startsWith("$") ? value.substring(1).trim() : value;
    }

    private static boolean isNone(String value) {
        String v = value.trim();
        return v.isEmpty() || v.equalsIgnoreCase("NONE") || v.equalsIgnoreCase("NULL");
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
