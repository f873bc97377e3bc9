package com.tfltimetable.backend.client;

import com.tfltimetable.backend.model.tfl.SearchResponse;
import com.tfltimetable.backend.model.tfl.StopPoint;
import com.tfltimetable.backend.model.tfl.TimetableResponse;
import org.springframework.util.MultiValueMap;

import java.util.List;

/**
 * The TfL unified API operations the timetable service relies on. Every call blocks and throws
 * {@link com.tfltimetable.backend.exception.UpstreamUnavailableException} on failure.
 */
public interface TflApi {

    SearchResponse searchStopPoints(String query, String mode);

    /**
     * Batch fetch. TfL answers a single id with a bare object rather than an array, so callers
     * must send at least two ids.
     */
    List<StopPoint> getStopPoints(List<String> ids);

    /**
     * @param toStopPointId optional, null for the whole line from {@code fromStopPointId}
     * @param extraParams   additional query parameters, e.g. taken from a disambiguation option
     */
    TimetableResponse getTimetable(String lineId, String fromStopPointId, String toStopPointId,
            MultiValueMap<String, String> extraParams);
}
