package com.tfltimetable.backend.service;

import com.tfltimetable.backend.exception.NoScheduleDataException;
import com.tfltimetable.backend.model.Journey;
import com.tfltimetable.backend.model.Stop;
import com.tfltimetable.backend.model.TimetableModel;
import com.tfltimetable.backend.model.tfl.TimetableResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link TimetableModel} from a raw TfL timetable payload.
 * <p>
 * The first route with at least one schedule is used, and within it the first schedule.
 * The requested direction is not taken into account.
 */
@Component
@Slf4j
public class TimetableModelBuilder {

    static final String STATION_ONLY_SUFFIX = " [S]";

    public TimetableModel build(TimetableResponse response) {
        if (response == null || response.getTimetable() == null
                || response.getTimetable().getRoutes() == null
                || response.getTimetable().getRoutes().isEmpty()) {
            throw new NoScheduleDataException("No timetable data available");
        }

        TimetableResponse.TimetableRoute route = null;
        for (TimetableResponse.TimetableRoute candidate : response.getTimetable().getRoutes()) {
            if (candidate != null && candidate.getSchedules() != null && !candidate.getSchedules().isEmpty()) {
                route = candidate;
                break;
            }
        }
        if (route == null) {
            throw new NoScheduleDataException("No schedules found in any route of line " + response.getLineId());
        }
        TimetableResponse.Schedule schedule = route.getSchedules().get(0);

        Map<String, String> names = buildNameLookup(response);
        String departureStopId = response.getTimetable().getDepartureStopId();

        List<Stop> stops = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        stops.add(stop(departureStopId, names));
        seen.add(departureStopId);

        Map<Integer, Map<String, Double>> intervalOffsets = new LinkedHashMap<>();
        if (route.getStationIntervals() != null) {
            for (TimetableResponse.StationInterval group : route.getStationIntervals()) {
                Map<String, Double> offsets = new HashMap<>();
                offsets.put(departureStopId, 0.0);

                if (group.getIntervals() != null) {
                    for (TimetableResponse.Interval interval : group.getIntervals()) {
                        String stopId = interval.getStopId();
                        if (stopId == null) {
                            continue;
                        }
                        if (!stopId.equals(departureStopId)) {
                            offsets.put(stopId, interval.getTimeToArrival());
                        }
                        if (seen.add(stopId)) {
                            stops.add(stop(stopId, names));
                        }
                    }
                }
                intervalOffsets.put(parseIntervalId(group.getId()), offsets);
            }
        }

        List<Journey> journeys = new ArrayList<>();
        if (schedule.getKnownJourneys() != null) {
            for (TimetableResponse.KnownJourney known : schedule.getKnownJourneys()) {
                journeys.add(Journey.builder()
                        .hour(known.getHour())
                        .minute(known.getMinute())
                        .intervalId(known.getIntervalId())
                        .build());
            }
        }

        log.debug("Built timetable model for line {}: {} stops, {} interval groups, {} journeys",
                response.getLineId(), stops.size(), intervalOffsets.size(), journeys.size());

        return TimetableModel.builder()
                .lineName(response.getLineName())
                .scheduleName(schedule.getName())
                .departureStopId(departureStopId)
                .stops(stops)
                .intervalOffsets(intervalOffsets)
                .journeys(journeys)
                .build();
    }

    // Stops first; station-only entries are marked so the two sources stay distinguishable
    private Map<String, String> buildNameLookup(TimetableResponse response) {
        Map<String, String> names = new HashMap<>();
        if (response.getStops() != null) {
            for (TimetableResponse.MatchedStop stop : response.getStops()) {
                names.put(stop.getId(), stop.getName());
            }
        }
        if (response.getStations() != null) {
            for (TimetableResponse.MatchedStop station : response.getStations()) {
                names.putIfAbsent(station.getId(), station.getName() + STATION_ONLY_SUFFIX);
            }
        }
        return names;
    }

    private Stop stop(String id, Map<String, String> names) {
        String name = names.get(id);
        return Stop.builder()
                .id(id)
                .name(name != null ? name : id)
                .build();
    }

    private int parseIntervalId(String id) {
        if (id == null) {
            log.warn("⚠️ Interval group without id, using 0");
            return 0;
        }
        try {
            return Integer.parseInt(id.trim());
        } catch (NumberFormatException e) {
            log.warn("⚠️ Unparseable interval group id '{}', using 0", id);
            return 0;
        }
    }
}
