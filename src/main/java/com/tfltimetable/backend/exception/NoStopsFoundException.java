package com.tfltimetable.backend.exception;

public class NoStopsFoundException extends TimetableException {

    public NoStopsFoundException(String stationName, String mode) {
        super("No lines or stops found for '" + stationName + "' (mode: " + mode + ")");
    }
}
