package com.tfltimetable.backend.exception;

/**
 * The TfL API could not be reached, answered with a non-success status, timed out
 * or returned a body that could not be decoded.
 */
public class UpstreamUnavailableException extends TimetableException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
