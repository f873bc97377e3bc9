package com.tfltimetable.backend.exception;

public class AmbiguousQueryException extends TimetableException {

    public AmbiguousQueryException(String message) {
        super(message);
    }

    public AmbiguousQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
