package com.eventaudit.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Daily event-count points for any number of events, date ascending.
 */
@Value
public class EventSeries {

    List<TimeSeriesPoint> points;

    @JsonCreator
    public EventSeries(@JsonProperty("points") List<TimeSeriesPoint> points) {
        this.points = points == null ? List.of() : List.copyOf(points);
    }

    /**
     * Points grouped per event name, each list keeping date order.
     */
    public Map<String, List<TimeSeriesPoint>> byEvent() {
        return points.stream().collect(Collectors.groupingBy(
                TimeSeriesPoint::getEventName, TreeMap::new, Collectors.toList()));
    }
}
