package com.eventaudit.infrastructure.backend;

import lombok.Value;

import java.util.Map;

/**
 * Opaque parameters bound to a query class. The core never builds SQL.
 */
@Value
public class QuerySpec {
    String queryClass;
    Map<String, Object> parameters;

    public static QuerySpec of(String queryClass, Map<String, Object> parameters) {
        return new QuerySpec(queryClass, Map.copyOf(parameters));
    }
}
