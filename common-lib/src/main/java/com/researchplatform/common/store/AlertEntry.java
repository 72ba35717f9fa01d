package com.researchplatform.common.store;

import com.researchplatform.common.model.Alert;
import com.researchplatform.common.model.AlertType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted form of an {@link Alert} inside the alert log file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertEntry {

    private String              timestamp;
    private String              type;
    private String              symbol;
    private String              message;
    private Map<String, Object> details;

    public static AlertEntry from(Alert alert) {
        return new AlertEntry(alert.timestamp().toString(), alert.type().name(), alert.symbol(),
            alert.message(), new LinkedHashMap<>(alert.details()));
    }

    public Alert toAlert() {
        Map<String, Object> safeDetails = new LinkedHashMap<>();
        if (details != null) {
            details.forEach((k, v) -> { if (v != null) safeDetails.put(k, v); });
        }
        return new Alert(Instant.parse(timestamp), AlertType.valueOf(type), symbol, message, safeDetails);
    }
}
