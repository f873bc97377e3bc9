package com.tfltimetable.backend.service;

import com.tfltimetable.backend.client.TflApi;
import com.tfltimetable.backend.exception.AmbiguousQueryException;
import com.tfltimetable.backend.exception.NoScheduleDataException;
import com.tfltimetable.backend.model.TimetableModel;
import com.tfltimetable.backend.model.tfl.TimetableResponse;
import com.tfltimetable.backend.model.tfl.TimetableResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TimetableService {

    private final TflApi tflApiClient;
    private final StopResolver stopResolver;
    private final TimetableModelBuilder modelBuilder;
    private final TextRenderer textRenderer;

    public String renderTimetable(String lineId, String fromStopPointId, String toStopPointId,
            int maxJourneys, int columnWidth) {
        TimetableResponse response = fetchTimetable(lineId, fromStopPointId, toStopPointId);
        return render(response, maxJourneys, columnWidth);
    }

    /**
     * Renders an already fetched timetable payload. No network access.
     */
    public String render(TimetableResponse response, int maxJourneys, int columnWidth) {
        TimetableModel model = modelBuilder.build(response);
        return textRenderer.render(model, model.getJourneys(), maxJourneys, columnWidth);
    }

    /**
     * Fetches the timetable of a line from a stop point, optionally towards another one.
     * Hub ids are resolved to a platform first. When TfL answers with disambiguation options
     * the first option is followed once.
     */
    public TimetableResponse fetchTimetable(String lineId, String fromStopPointId, String toStopPointId) {
        String from = stopResolver.resolvePlatformId(fromStopPointId);
        String to = toStopPointId != null ? stopResolver.resolvePlatformId(toStopPointId) : null;

        log.info("🚇 Fetching timetable | Line: {} | From: {} | To: {}", lineId, from, to != null ? to : "ANY");
        TimetableResult result = TimetableResult.of(
                tflApiClient.getTimetable(lineId, from, to, new LinkedMultiValueMap<>()));

        switch (result.getKind()) {
            case TIMETABLE:
                return result.getTimetable();
            case DISAMBIGUATION:
                return followDisambiguation(lineId, from, to, result.getDisambiguationOptions());
            default:
                throw new NoScheduleDataException("No timetable payload received for line " + lineId + " from " + from);
        }
    }

    private TimetableResponse followDisambiguation(String lineId, String from, String to,
            List<TimetableResponse.DisambiguationOption> options) {
        if (options.isEmpty() || options.get(0).getUri() == null) {
            throw new AmbiguousQueryException("Timetable query for line " + lineId + " from " + from
                    + " is ambiguous and no option was offered");
        }

        TimetableResponse.DisambiguationOption option = options.get(0);
        MultiValueMap<String, String> queryParams = new LinkedMultiValueMap<>();
        try {
            // option uris arrive percent-encoded; the client encodes again on the way out
            UriComponentsBuilder.fromUriString(option.getUri()).build().getQueryParams()
                    .forEach((name, values) -> values.forEach(value -> queryParams.add(
                            UriUtils.decode(name, StandardCharsets.UTF_8),
                            value != null ? UriUtils.decode(value, StandardCharsets.UTF_8) : "")));
        } catch (IllegalArgumentException e) {
            throw new AmbiguousQueryException("Cannot follow disambiguation option '" + option.getUri() + "'", e);
        }
        log.info("🔀 Timetable query ambiguous ({} options), following '{}'", options.size(), option.getUri());

        TimetableResult retried = TimetableResult.of(
                tflApiClient.getTimetable(lineId, from, to, queryParams));
        switch (retried.getKind()) {
            case TIMETABLE:
                return retried.getTimetable();
            case DISAMBIGUATION:
                throw new AmbiguousQueryException("Timetable query for line " + lineId + " from " + from
                        + " is still ambiguous after following '" + option.getUri() + "'");
            default:
                throw new NoScheduleDataException("No timetable payload received for line " + lineId + " from " + from);
        }
    }
}
