package com.tfltimetable.backend.exception;

public class NoScheduleDataException extends TimetableException {

    public NoScheduleDataException(String message) {
        super(message);
    }
}
