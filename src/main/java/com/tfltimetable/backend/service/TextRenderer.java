package com.tfltimetable.backend.service;

import com.tfltimetable.backend.model.Journey;
import com.tfltimetable.backend.model.Stop;
import com.tfltimetable.backend.model.TimetableModel;
import com.tfltimetable.backend.util.ArrivalCalculator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Fixed-width text grid: one row per stop, one column per train.
 */
@Component
public class TextRenderer {

    static final int TRAIN_COLUMN_WIDTH = 10;
    static final String SEPARATOR = " | ";
    static final String ELLIPSIS = "...";
    static final int MAX_STATION_COLUMN_WIDTH = 200;

    // Route defines no interval group at all
    public static final String UNRESOLVED_INTERVAL = "err";
    // Journey's interval group does not call at this stop
    public static final String NOT_CALLING = "---";

    /**
     * @param maxJourneys        keeps only the first {@code maxJourneys}; 0 or less keeps all
     * @param stationColumnWidth width of the station column, between 3 and 200
     */
    public String render(TimetableModel model, List<Journey> journeys, int maxJourneys, int stationColumnWidth) {
        if (stationColumnWidth < ELLIPSIS.length()) {
            throw new IllegalArgumentException("Station column width must be at least " + ELLIPSIS.length()
                    + ", got " + stationColumnWidth);
        }
        if (stationColumnWidth > MAX_STATION_COLUMN_WIDTH) {
            throw new IllegalArgumentException("Station column width must be at most " + MAX_STATION_COLUMN_WIDTH
                    + ", got " + stationColumnWidth);
        }

        List<Journey> shown = journeys;
        if (maxJourneys > 0 && shown.size() > maxJourneys) {
            shown = shown.subList(0, maxJourneys);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Timetable for ").append(model.getLineName())
                .append(" at ").append(model.getDepartureStopId()).append("\n\n");
        sb.append("Schedule: ").append(model.getScheduleName()).append('\n');

        sb.append(pad("Station", stationColumnWidth));
        for (int i = 0; i < shown.size(); i++) {
            sb.append(SEPARATOR).append(pad("Train " + (i + 1), TRAIN_COLUMN_WIDTH));
        }
        sb.append('\n');
        sb.append("-".repeat(stationColumnWidth + shown.size() * (TRAIN_COLUMN_WIDTH + SEPARATOR.length())));
        sb.append('\n');

        for (Stop stop : model.getStops()) {
            sb.append(pad(truncate(stop.getName(), stationColumnWidth), stationColumnWidth));
            for (Journey journey : shown) {
                sb.append(SEPARATOR).append(pad(cell(model, stop, journey), TRAIN_COLUMN_WIDTH));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private String cell(TimetableModel model, Stop stop, Journey journey) {
        Map<String, Double> offsets = model.offsetsFor(journey.getIntervalId());
        if (offsets == null) {
            return UNRESOLVED_INTERVAL;
        }
        Double offset = offsets.get(stop.getId());
        if (offset == null) {
            return NOT_CALLING;
        }
        return ArrivalCalculator.arrival(journey.getHour(), journey.getMinute(), offset);
    }

    static String truncate(String name, int width) {
        if (name == null) {
            return "";
        }
        if (name.length() <= width) {
            return name;
        }
        return name.substring(0, width - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static String pad(String value, int width) {
        return String.format("%-" + width + "s", value);
    }
}
