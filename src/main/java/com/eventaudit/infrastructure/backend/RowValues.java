package com.eventaudit.infrastructure.backend;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Typed access to backend row cells.
 *
 * Accepts the java.time values the JDBC connector produces as well as their
 * string forms. A missing or unparseable required cell is an
 * {@link IllegalArgumentException}: the row does not match its query class.
 */
public final class RowValues {

    private RowValues() {
    }

    public static String string(Map<String, Object> row, String column) {
        Object value = required(row, column);
        return value.toString();
    }

    public static LocalDate date(Map<String, Object> row, String column) {
        Object value = required(row, column);
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC).toLocalDate();
        }
        String text = value.toString();
        return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    }

    public static double number(Map<String, Object> row, String column) {
        Object value = required(row, column);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    public static long count(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString());
    }

    /**
     * @return the instant, or null when the cell is null
     */
    public static Instant instant(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        return Instant.parse(value.toString());
    }

    private static Object required(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            throw new IllegalArgumentException("Missing value for column '" + column + "' in row " + row.keySet());
        }
        return value;
    }
}
