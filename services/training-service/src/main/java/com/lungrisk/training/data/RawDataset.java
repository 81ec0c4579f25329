package com.lungrisk.training.data;

import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Rows of the training source as text, keyed by header name.
 */
@Getter
public class RawDataset {

    private final String source;
    private final List<String> columns;
    private final List<Map<String, String>> rows;

    public RawDataset(String source, List<String> columns, List<Map<String, String>> rows) {
        this.source = source;
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
