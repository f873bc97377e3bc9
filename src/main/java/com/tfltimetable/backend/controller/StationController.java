package com.tfltimetable.backend.controller;

import com.tfltimetable.backend.exception.NoStopsFoundException;
import com.tfltimetable.backend.model.LineAttachment;
import com.tfltimetable.backend.model.PlatformResolution;
import com.tfltimetable.backend.service.StopResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;

@RestController
@RequestMapping("/api/v1/stations")
@RequiredArgsConstructor
@Tag(name = "Stations", description = "Resolve stations to the lines and platforms serving them")
public class StationController {

    private final StopResolver stopResolver;

    @Operation(summary = "Resolve Station", description = "Finds the (line, platform) pairs servable from a station, expanding hubs to their platforms.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Pairs found"),
            @ApiResponse(responseCode = "404", description = "No matching station", content = @Content),
            @ApiResponse(responseCode = "502", description = "TfL unavailable", content = @Content)
    })
    @GetMapping("/resolve")
    public List<LineAttachment> resolve(
            @Parameter(description = "Station name (e.g. Richmond)", required = true) @RequestParam String name,
            @Parameter(description = "Transport mode (e.g. tube)") @RequestParam(defaultValue = "${timetable.demo.mode:tube}") String mode) {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Station name must not be blank");
        }
        List<LineAttachment> attachments = stopResolver.resolve(name.trim(), mode);
        if (attachments.isEmpty()) {
            throw new NoStopsFoundException(name.trim(), mode);
        }
        return attachments;
    }

    @Operation(summary = "Resolve Platform", description = "Resolves a hub stop point id to its first platform; platform ids are returned unchanged.")
    @GetMapping("/{stopPointId}/platform")
    public PlatformResolution resolvePlatform(
            @Parameter(description = "Stop point id (e.g. HUBRMD)", required = true) @PathVariable String stopPointId) {
        return PlatformResolution.builder()
                .stopPointId(stopPointId)
                .platformId(stopResolver.resolvePlatformId(stopPointId))
                .build();
    }
}
