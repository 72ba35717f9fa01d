package com.researchplatform.analysis.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.analysis.frame.SeriesFrame;
import com.researchplatform.analysis.profile.DatasetProfile;
import com.researchplatform.common.json.LlmJson;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Two-stage decoding of the planner reply: {@link #decodeStructured} for a well-formed JSON plan,
 * {@link #fallbackPlan} for everything else.
 */
public final class PlanDecoder {

    static final String FALLBACK_INSIGHTS = "Analysis generated, but detailed insights could not be parsed.";

    private PlanDecoder() {}

    /**
     * Reads {@code insights} (array of strings) and {@code visualizations} (array of objects with
     * {@code type} or {@code chart_type}, {@code columns}, {@code title}). Empty when the text holds
     * no JSON object or {@code visualizations} is missing or not an array.
     */
    public static Optional<AnalysisPlan> decodeStructured(String text, ObjectMapper objectMapper) {
        Optional<JsonNode> parsed = LlmJson.parseObject(text, objectMapper);
        if (parsed.isEmpty()) return Optional.empty();
        JsonNode root = parsed.get();

        JsonNode vizNode = root.path("visualizations");
        if (!vizNode.isArray()) return Optional.empty();

        List<String> insights = new ArrayList<>();
        JsonNode insightsNode = root.path("insights");
        if (insightsNode.isArray()) {
            insightsNode.forEach(item -> {
                if (item.isValueNode() && !item.asText().isBlank()) insights.add(item.asText().trim());
            });
        } else if (insightsNode.isTextual() && !insightsNode.asText().isBlank()) {
            insights.add(insightsNode.asText().trim());
        }

        List<VisualizationSpec> visualizations = new ArrayList<>();
        for (JsonNode entry : vizNode) {
            if (!entry.isObject()) continue;
            String type = entry.hasNonNull("type") ? entry.get("type").asText() : entry.path("chart_type").asText(null);
            List<String> columns = new ArrayList<>();
            JsonNode columnsNode = entry.path("columns");
            if (columnsNode.isArray()) {
                columnsNode.forEach(column -> columns.add(column.asText()));
            } else if (columnsNode.isTextual()) {
                columns.add(columnsNode.asText());
            }
            visualizations.add(new VisualizationSpec(type, columns, entry.path("title").asText("")));
        }
        return Optional.of(new AnalysisPlan(insights, visualizations, false));
    }

    /** Close-over-time line chart and volume histogram, with an explanatory insights note. */
    public static AnalysisPlan fallbackPlan(DatasetProfile profile) {
        String x = profile.primaryDatetimeColumn();
        return new AnalysisPlan(
            List.of(FALLBACK_INSIGHTS),
            List.of(
                new VisualizationSpec(ChartType.LINE.wire(), List.of(x, SeriesFrame.CLOSE), "Closing Price Over Time (Default)"),
                new VisualizationSpec(ChartType.HISTOGRAM.wire(), List.of(SeriesFrame.VOLUME), "Trading Volume (Default)")),
            true);
    }
}
