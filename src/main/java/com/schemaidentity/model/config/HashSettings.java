package com.schemaidentity.model.config;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of the tracking options that shaped a hash, kept alongside it in reports.
 */
@Value
@Builder
public class HashSettings {
    boolean trackDescriptions;
    boolean trackFieldOrder;
    boolean trackTypeOrder;
    int trackedFilepathParts;
    boolean trackValidationMode;

    public static HashSettings from(HashConfig config) {
        return HashSettings.builder()
                .trackDescriptions(config.isTrackDescriptions())
                .trackFieldOrder(config.isTrackFieldOrder())
                .trackTypeOrder(config.isTrackTypeOrder())
                .trackedFilepathParts(config.getTrackedFilepathParts())
                .trackValidationMode(config.isTrackValidationMode())
                .build();
    }
}
