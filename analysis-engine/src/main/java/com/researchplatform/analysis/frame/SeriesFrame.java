package com.researchplatform.analysis.frame;

import com.researchplatform.common.model.PriceBar;
import com.researchplatform.common.model.Provenance;
import com.researchplatform.common.model.TimeSeries;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Column-oriented view of a single-symbol series, the input to profiling and chart rendering.
 * Column names are lower case; rows are in time order.
 */
public final class SeriesFrame {

    public static final String TIMESTAMP = "timestamp";
    public static final String OPEN = "open";
    public static final String HIGH = "high";
    public static final String LOW = "low";
    public static final String CLOSE = "close";
    public static final String VOLUME = "volume";

    private final String symbol;
    private final Provenance provenance;
    private final String sourceNote;
    private final Map<String, ColumnType> types;
    private final Map<String, List<?>> columns;
    private final int rowCount;

    private SeriesFrame(String symbol, Provenance provenance, String sourceNote,
                        Map<String, ColumnType> types, Map<String, List<?>> columns, int rowCount) {
        this.symbol = symbol;
        this.provenance = provenance;
        this.sourceNote = sourceNote;
        this.types = Collections.unmodifiableMap(types);
        this.columns = Collections.unmodifiableMap(columns);
        this.rowCount = rowCount;
    }

    public static SeriesFrame from(TimeSeries series) {
        List<PriceBar> bars = new ArrayList<>(series.bars());
        bars.sort(Comparator.comparing(PriceBar::timestamp));

        List<LocalDateTime> timestamps = new ArrayList<>(bars.size());
        List<Double> open = new ArrayList<>(bars.size());
        List<Double> high = new ArrayList<>(bars.size());
        List<Double> low = new ArrayList<>(bars.size());
        List<Double> close = new ArrayList<>(bars.size());
        List<Long> volume = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) {
            timestamps.add(bar.timestamp());
            open.add(bar.open());
            high.add(bar.high());
            low.add(bar.low());
            close.add(bar.close());
            volume.add(bar.volume());
        }

        Map<String, ColumnType> types = new LinkedHashMap<>();
        Map<String, List<?>> columns = new LinkedHashMap<>();
        put(types, columns, TIMESTAMP, ColumnType.DATETIME, timestamps);
        put(types, columns, OPEN, ColumnType.FLOAT, open);
        put(types, columns, HIGH, ColumnType.FLOAT, high);
        put(types, columns, LOW, ColumnType.FLOAT, low);
        put(types, columns, CLOSE, ColumnType.FLOAT, close);
        put(types, columns, VOLUME, ColumnType.INTEGER, volume);
        return new SeriesFrame(series.symbol(), series.provenance(), series.sourceNote(), types, columns, bars.size());
    }

    public static SeriesFrame empty(String symbol) {
        return new SeriesFrame(symbol, null, null, new LinkedHashMap<>(), new LinkedHashMap<>(), 0);
    }

    private static void put(Map<String, ColumnType> types, Map<String, List<?>> columns,
                            String name, ColumnType type, List<?> values) {
        types.put(name, type);
        columns.put(name, List.copyOf(values));
    }

    public String symbol() { return symbol; }

    public Provenance provenance() { return provenance; }

    public String sourceNote() { return sourceNote; }

    public int rowCount() { return rowCount; }

    public boolean isEmpty() { return rowCount == 0; }

    public List<String> columnNames() { return List.copyOf(types.keySet()); }

    public Map<String, ColumnType> columnTypes() { return types; }

    public boolean hasColumn(String name) {
        return name != null && types.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Optional<ColumnType> type(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(types.get(name.toLowerCase(Locale.ROOT)));
    }

    public List<?> values(String name) {
        List<?> values = name == null ? null : columns.get(name.toLowerCase(Locale.ROOT));
        if (values == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return values;
    }

    public List<Double> numeric(String name) {
        ColumnType type = type(name).orElseThrow(() -> new IllegalArgumentException("Unknown column: " + name));
        if (!type.isNumeric()) {
            throw new IllegalArgumentException("Column is not numeric: " + name);
        }
        List<Double> result = new ArrayList<>(rowCount);
        for (Object value : values(name)) {
            result.add(((Number) value).doubleValue());
        }
        return result;
    }
}
