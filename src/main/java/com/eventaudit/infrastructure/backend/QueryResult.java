package com.eventaudit.infrastructure.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular rows returned by the backend. Immutable: rows are copied on the way in.
 *
 * Column values may be null; a null cell is data, not an absent column.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QueryResult {

    private final List<Map<String, Object>> rows;

    @JsonCreator
    public QueryResult(@JsonProperty("rows") List<Map<String, Object>> rows) {
        List<Map<String, Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static QueryResult empty() {
        return new QueryResult(List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
