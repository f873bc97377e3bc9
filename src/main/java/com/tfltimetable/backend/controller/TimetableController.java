package com.tfltimetable.backend.controller;

import com.tfltimetable.backend.service.TimetableService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/v1/timetable")
@RequiredArgsConstructor
@Tag(name = "Timetable", description = "Line timetables rendered as text grids")
public class TimetableController {

    private final TimetableService timetableService;

    @Operation(summary = "Render Timetable", description = "Fetches the timetable of a line from a stop point and renders it as a fixed-width grid, one row per stop and one column per train.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Rendered timetable", content = @Content(mediaType = "text/plain")),
            @ApiResponse(responseCode = "404", description = "No schedule for this line and stop", content = @Content),
            @ApiResponse(responseCode = "409", description = "Query still ambiguous", content = @Content),
            @ApiResponse(responseCode = "502", description = "TfL unavailable", content = @Content)
    })
    @GetMapping
    public ResponseEntity<String> getTimetable(
            @Parameter(description = "Line ID (e.g. district)", required = true) @RequestParam String lineId,
            @Parameter(description = "Departure stop point (e.g. 940GZZLURMD)", required = true) @RequestParam String stopPointId,
            @Parameter(description = "Optional destination stop point") @RequestParam(required = false) String toStopPointId,
            @Parameter(description = "Maximum trains shown, 0 for all") @RequestParam(defaultValue = "${timetable.max-journeys:200}") int maxJourneys,
            @Parameter(description = "Station column width") @RequestParam(defaultValue = "${timetable.station-column-width:50}") int columnWidth) {

        String grid = timetableService.renderTimetable(lineId, stopPointId, toStopPointId, maxJourneys, columnWidth);
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(grid);
    }
}
