package com.researchplatform.marketdata.client;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Timestamp formats used by Alpha Vantage series keys. */
final class SeriesTimestamps {

    private static final DateTimeFormatter INTRADAY_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private SeriesTimestamps() {}

    static Optional<LocalDateTime> parse(String raw) {
        if (raw == null) return Optional.empty();
        String value = raw.trim();
        try {
            return value.indexOf(' ') > 0
                ? Optional.of(LocalDateTime.parse(value, INTRADAY_FMT))
                : Optional.of(LocalDate.parse(value).atStartOfDay());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
