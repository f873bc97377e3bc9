package com.tfltimetable.backend.model.tfl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload of {@code GET /Line/{id}/Timetable/{from}}. Either {@code timetable} or
 * {@code disambiguation} is populated, see {@link TimetableResult}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimetableResponse {
    private String lineId;
    private String lineName;
    private String direction;
    private List<MatchedStop> stations;
    private List<MatchedStop> stops;
    private Timetable timetable;
    private Disambiguation disambiguation;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MatchedStop {
        private String id;
        private String name;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Timetable {
        private String departureStopId;
        private List<TimetableRoute> routes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimetableRoute {
        private List<StationInterval> stationIntervals;
        private List<Schedule> schedules;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StationInterval {
        // Numeric, but sent as a string
        private String id;
        private List<Interval> intervals;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Interval {
        private String stopId;
        private double timeToArrival;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Schedule {
        private String name;
        private List<KnownJourney> knownJourneys;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KnownJourney {
        private String hour;
        private String minute;
        private int intervalId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Disambiguation {
        private List<DisambiguationOption> disambiguationOptions;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DisambiguationOption {
        private String description;
        private String uri;
    }
}
