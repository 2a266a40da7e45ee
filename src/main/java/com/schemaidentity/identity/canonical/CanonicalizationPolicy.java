package com.schemaidentity.identity.canonical;

import com.schemaidentity.model.config.HashConfig;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * What the canonicalizer removes from a schema document before hashing.
 */
@Value
@With
@Builder
public class CanonicalizationPolicy {

    /** Sort string lists under {@code required}. */
    boolean sortRequired;

    /** Drop string-valued {@code description} entries. */
    boolean dropDescriptions;

    /** Collapse every other list (except under {@code default}) to a sorted list of strings. */
    boolean sortLists;

    public static CanonicalizationPolicy from(HashConfig config) {
        return CanonicalizationPolicy.builder()
                .sortRequired(!config.isTrackFieldOrder())
                .dropDescriptions(!config.isTrackDescriptions())
                .sortLists(!config.isTrackTypeOrder())
                .build();
    }
}
