package com.tfltimetable.backend.model.tfl;

import java.util.Collections;
import java.util.List;

/**
 * Classifies a timetable payload into exactly one of its mutually exclusive shapes.
 * Callers switch on {@link #getKind()} and only then read the matching accessor.
 */
public final class TimetableResult {

    public enum Kind {
        TIMETABLE, DISAMBIGUATION, EMPTY
    }

    private final Kind kind;
    private final TimetableResponse response;

    private TimetableResult(Kind kind, TimetableResponse response) {
        this.kind = kind;
        this.response = response;
    }

    public static TimetableResult of(TimetableResponse response) {
        if (response == null) {
            return new TimetableResult(Kind.EMPTY, null);
        }
        if (response.getTimetable() != null) {
            return new TimetableResult(Kind.TIMETABLE, response);
        }
        if (response.getDisambiguation() != null) {
            return new TimetableResult(Kind.DISAMBIGUATION, response);
        }
        return new TimetableResult(Kind.EMPTY, response);
    }

    public Kind getKind() {
        return kind;
    }

    public TimetableResponse getTimetable() {
        if (kind != Kind.TIMETABLE) {
            throw new IllegalStateException("Result is " + kind + ", not TIMETABLE");
        }
        return response;
    }

    /**
     * Offered options in upstream order; may be empty.
     */
    public List<TimetableResponse.DisambiguationOption> getDisambiguationOptions() {
        if (kind != Kind.DISAMBIGUATION) {
            throw new IllegalStateException("Result is " + kind + ", not DISAMBIGUATION");
        }
        List<TimetableResponse.DisambiguationOption> options = response.getDisambiguation()
                .getDisambiguationOptions();
        return options != null ? options : Collections.emptyList();
    }
}
