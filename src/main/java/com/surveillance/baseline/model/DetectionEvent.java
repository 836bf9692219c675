package com.surveillance.baseline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * One observed detection as handed over by ingestion. The timestamp's own offset
 * decides which hour / day-of-week slot it lands in. Callers holding an {@code Instant}
 * build events through {@code BaselineService.detectionAt}, which applies the configured zone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionEvent {

    private String cameraId;
    private String detectionClass;
    private OffsetDateTime timestamp;
}
