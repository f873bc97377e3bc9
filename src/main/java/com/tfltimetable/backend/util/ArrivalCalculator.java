package com.tfltimetable.backend.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wall-clock arithmetic for timetable cells.
 */
public final class ArrivalCalculator {

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private ArrivalCalculator() {
    }

    /**
     * Arrival time of a journey at a stop, as {@code HH:MM} on a 24 hour clock.
     * Hour and minute are parsed leniently: text without a leading integer counts as 0.
     * The offset is truncated toward zero before it is added, and the result wraps past
     * midnight in both directions.
     */
    public static String arrival(String hour, String minute, double offsetMinutes) {
        long total = parseLenient(hour) * 60 + parseLenient(minute) + (long) offsetMinutes;
        long displayHour = Math.floorMod(Math.floorDiv(total, 60L), 24L);
        long displayMinute = Math.floorMod(total, 60L);
        return String.format("%02d:%02d", displayHour, displayMinute);
    }

    static long parseLenient(String value) {
        if (value == null) {
            return 0;
        }
        Matcher matcher = LEADING_INTEGER.matcher(value);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            // out of int range
            return 0;
        }
    }
}
