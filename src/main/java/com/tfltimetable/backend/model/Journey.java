package com.tfltimetable.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Journey {
    // Kept as received; parsed leniently when rendered
    private String hour;
    private String minute;
    private int intervalId;
}
