package com.researchplatform.analysis.profile;

import com.researchplatform.analysis.frame.ColumnType;
import com.researchplatform.analysis.frame.SeriesFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class DatasetProfiler {

    private static final Logger log = LoggerFactory.getLogger(DatasetProfiler.class);

    public DatasetProfile profile(SeriesFrame frame) {
        List<String> columns = frame.columnNames();
        Map<String, String> columnTypes = new LinkedHashMap<>();
        List<String> numeric = new ArrayList<>();
        List<String> datetime = new ArrayList<>();
        frame.columnTypes().forEach((name, type) -> {
            columnTypes.put(name, type.dtype());
            if (type.isNumeric()) numeric.add(name);
            if (type == ColumnType.DATETIME) datetime.add(name);
        });

        DatasetProfile profile = new DatasetProfile(frame.rowCount(), columns.size(), columns,
            columnTypes, numeric, datetime);
        log.info("[Analysis] Profile built. symbol={} rows={} columns={}", frame.symbol(), profile.rowCount(), columns);
        return profile;
    }
}
