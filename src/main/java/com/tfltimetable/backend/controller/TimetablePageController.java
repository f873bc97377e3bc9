package com.tfltimetable.backend.controller;

import com.tfltimetable.backend.exception.NoStopsFoundException;
import com.tfltimetable.backend.exception.UpstreamUnavailableException;
import com.tfltimetable.backend.model.LineAttachment;
import com.tfltimetable.backend.service.StopResolver;
import com.tfltimetable.backend.service.TimetableService;
import io.swagger.v3.oas.annotations.Hidden;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Minimal HTML front end: station search, timetable page and a demo shortcut.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Hidden
public class TimetablePageController {

    private final StopResolver stopResolver;
    private final TimetableService timetableService;

    @Value("${timetable.demo.station-name}")
    private String demoStationName;

    @Value("${timetable.demo.mode}")
    private String defaultMode;

    @Value("${timetable.max-journeys}")
    private int maxJourneys;

    @Value("${timetable.station-column-width}")
    private int stationColumnWidth;

    @GetMapping("/")
    public ResponseEntity<String> search(@RequestParam(value = "q", required = false) String query) {
        StringBuilder html = new StringBuilder();
        String escaped = query != null ? HtmlUtils.htmlEscape(query) : "";
        html.append("<h1>TFL Timetable Search</h1>")
                .append("<form method='GET' action='/'>")
                .append("<input type='text' name='q' value='").append(escaped)
                .append("' placeholder='Enter station name...'>")
                .append("<button type='submit'>Search</button>")
                .append("</form>");

        if (!StringUtils.hasText(query)) {
            return html(html.toString());
        }

        List<LineAttachment> pairs;
        try {
            pairs = stopResolver.resolve(query.trim(), defaultMode);
        } catch (UpstreamUnavailableException e) {
            log.warn("⚠️ Search page could not reach TfL for '{}': {}", query, e.getMessage());
            return html(html.append("<p style='color:red'>Error: ")
                    .append(HtmlUtils.htmlEscape(e.getMessage()))
                    .append("</p>").toString());
        }

        if (pairs.isEmpty()) {
            return html(html.append("<p>No results found for '").append(escaped).append("'</p>").toString());
        }

        html.append("<h2>Results for '").append(escaped).append("'</h2><ul>");
        for (LineAttachment pair : pairs) {
            html.append("<li><a href='").append(HtmlUtils.htmlEscape(timetableLink(pair).toString())).append("'>")
                    .append(HtmlUtils.htmlEscape(StringUtils.capitalize(pair.getLineId())))
                    .append(" Line at Stop ")
                    .append(HtmlUtils.htmlEscape(pair.getPlatformId()))
                    .append("</a></li>");
        }
        return html(html.append("</ul>").toString());
    }

    @GetMapping("/timetable")
    public ResponseEntity<String> timetable(@RequestParam("line_id") String lineId,
            @RequestParam("stop_point_id") String stopPointId) {
        String grid = timetableService.renderTimetable(lineId, stopPointId, null, maxJourneys, stationColumnWidth);
        return html("<html><body><h1>Timetable for " + HtmlUtils.htmlEscape(stopPointId) + "</h1>"
                + "<pre>" + HtmlUtils.htmlEscape(grid) + "</pre></body></html>");
    }

    /**
     * Redirects to the timetable of the first line found at the demo station.
     */
    @GetMapping("/demo")
    public ResponseEntity<Void> demo() {
        List<LineAttachment> pairs = stopResolver.resolve(demoStationName, defaultMode);
        if (pairs.isEmpty()) {
            throw new NoStopsFoundException(demoStationName, defaultMode);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setLocation(timetableLink(pairs.get(0)));
        return new ResponseEntity<>(headers, HttpStatus.FOUND);
    }

    private static ResponseEntity<String> html(String body) {
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8))
                .body(body);
    }

    private URI timetableLink(LineAttachment pair) {
        return UriComponentsBuilder.fromPath("/timetable")
                .queryParam("line_id", pair.getLineId())
                .queryParam("stop_point_id", pair.getPlatformId())
                .encode()
                .build()
                .toUri();
    }
}
