package com.tfltimetable.backend.service;

import com.tfltimetable.backend.exception.NoScheduleDataException;
import com.tfltimetable.backend.model.Stop;
import com.tfltimetable.backend.model.TimetableModel;
import com.tfltimetable.backend.model.tfl.TimetableResponse;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.tfltimetable.backend.service.TimetableFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TimetableModelBuilderTest {

    private final TimetableModelBuilder builder = new TimetableModelBuilder();

    private static List<String> stopIds(TimetableModel model) {
        return model.getStops().stream().map(Stop::getId).collect(Collectors.toList());
    }

    @Test
    void testBuild_StopsInFirstDiscoveryOrderWithoutDuplicates() {
        TimetableResponse response = response("DEP", route(List.of(
                group("1", "C", 9, "A", 5),
                group("2", "A", 4, "B", 7, "C", 10),
                group("3", "D", 1)),
                schedule("Weekday", journey("10", "00", 1))));

        TimetableModel model = builder.build(response);

        assertEquals(List.of("DEP", "C", "A", "B", "D"), stopIds(model));
    }

    @Test
    void testBuild_DepartureStopIsRowZeroWithZeroOffsetEverywhere() {
        TimetableResponse response = response("DEP", route(List.of(
                group("1", "A", 5),
                group("2", "DEP", 3, "B", 8)),
                schedule("Weekday", journey("10", "00", 1))));

        TimetableModel model = builder.build(response);

        assertEquals("DEP", model.getStops().get(0).getId());
        assertEquals("DEP", model.getDepartureStopId());
        for (Map<String, Double> offsets : model.getIntervalOffsets().values()) {
            assertEquals(0.0, offsets.get("DEP"));
        }
        assertEquals(3, model.getStops().size());
    }

    @Test
    void testBuild_IntervalTablesKeyedByParsedIdInRouteOrder() {
        TimetableResponse response = response("DEP", route(List.of(
                group("7", "A", 5),
                group("2", "A", 8, "B", 15),
                group("oops", "C", 1)),
                schedule("Weekday", journey("10", "00", 7))));

        TimetableModel model = builder.build(response);

        assertEquals(List.of(7, 2, 0), new ArrayList<>(model.getIntervalOffsets().keySet()));
        assertEquals(15.0, model.getIntervalOffsets().get(2).get("B"));
        assertNull(model.getIntervalOffsets().get(7).get("B"));
    }

    @Test
    void testBuild_PicksFirstRouteWithScheduleAndItsFirstSchedule() {
        TimetableResponse.TimetableRoute empty = route(List.of(group("1", "X", 1)));
        TimetableResponse.TimetableRoute used = route(List.of(group("1", "A", 5)),
                schedule("Saturday", journey("06", "00", 1), journey("07", "00", 1)),
                schedule("Sunday", journey("08", "00", 1)));

        TimetableModel model = builder.build(response("DEP", empty, used));

        assertEquals("Saturday", model.getScheduleName());
        assertEquals(List.of("DEP", "A"), stopIds(model));
        assertEquals(2, model.getJourneys().size());
        assertEquals("06", model.getJourneys().get(0).getHour());
        assertEquals("07", model.getJourneys().get(1).getHour());
    }

    @Test
    void testBuild_NoRouteWithSchedule_Throws() {
        TimetableResponse noSchedules = response("DEP", route(List.of(group("1", "A", 5))));
        assertThrows(NoScheduleDataException.class, () -> builder.build(noSchedules));

        TimetableResponse noTimetable = TimetableResponse.builder().lineId("district").build();
        assertThrows(NoScheduleDataException.class, () -> builder.build(noTimetable));

        TimetableResponse noRoutes = response("DEP");
        noRoutes.getTimetable().setRoutes(Collections.emptyList());
        assertThrows(NoScheduleDataException.class, () -> builder.build(noRoutes));
    }

    @Test
    void testBuild_NamesFromStopsThenStationsWithMarker() throws Exception {
        TimetableResponse response = load("richmond_district_timetable.json", TimetableResponse.class);

        TimetableModel model = builder.build(response);

        assertEquals("District", model.getLineName());
        assertEquals("Monday - Friday", model.getScheduleName());
        assertEquals(List.of("940GZZLURMD", "940GZZLUKWG", "940GZZLUGBY", "940GZZLUTNG"), stopIds(model));
        assertEquals("Richmond Underground Station", model.getStops().get(0).getName());
        assertEquals("Turnham Green Underground Station [S]", model.getStops().get(3).getName());
        assertEquals(3, model.getJourneys().size());
        assertEquals(4.5, model.getIntervalOffsets().get(0).get("940GZZLUGBY"));
    }

    @Test
    void testBuild_UnknownStopNameFallsBackToId() {
        TimetableResponse response = response("DEP", route(List.of(group("1", "A", 5)),
                schedule("Weekday", journey("10", "00", 1))));
        response.setStops(null);

        TimetableModel model = builder.build(response);

        assertEquals("A", model.getStops().get(1).getName());
    }
}
