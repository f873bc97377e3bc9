package com.tfltimetable.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Render-ready view of one schedule of one route. Row 0 of {@code stops} is always the
 * departure stop and every offset table maps the departure stop to 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimetableModel {

    private String lineName;
    private String scheduleName;
    private String departureStopId;

    @Builder.Default
    private List<Stop> stops = new ArrayList<>();

    // Interval group id -> (stop id -> minutes from departure), in route order
    @Builder.Default
    private Map<Integer, Map<String, Double>> intervalOffsets = new LinkedHashMap<>();

    @Builder.Default
    private List<Journey> journeys = new ArrayList<>();

    /**
     * Offsets for the given interval group, falling back to the first group of the route.
     * Returns null when the route defines no interval group at all.
     */
    public Map<String, Double> offsetsFor(int intervalId) {
        Map<String, Double> offsets = intervalOffsets.get(intervalId);
        if (offsets != null) {
            return offsets;
        }
        if (intervalOffsets.isEmpty()) {
            return null;
        }
        return intervalOffsets.values().iterator().next();
    }
}
