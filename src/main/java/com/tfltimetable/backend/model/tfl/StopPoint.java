package com.tfltimetable.backend.model.tfl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A TfL stop point. Hubs carry their platforms (and intermediate groupings) as
 * {@code children}; platforms carry the lines serving them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StopPoint {
    private String id;
    private String naptanId;
    private String commonName;
    private String stopType;
    private List<StopPoint> children;
    private List<Identifier> lines;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Identifier {
        private String id;
        private String name;
    }
}
