package com.tfltimetable.backend.exception;

/**
 * Base type for failures surfaced to the caller of a timetable or station request.
 */
public abstract class TimetableException extends RuntimeException {

    protected TimetableException(String message) {
        super(message);
    }

    protected TimetableException(String message, Throwable cause) {
        super(message, cause);
    }
}
