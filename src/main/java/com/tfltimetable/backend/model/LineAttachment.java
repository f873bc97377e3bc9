package com.tfltimetable.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A line serving a concrete platform. The platform id is always platform level, never a hub.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineAttachment {
    private String lineId;
    private String platformId;
}
