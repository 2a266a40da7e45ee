package com.schemaidentity.model.config;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.schemaidentity.identity.hash.HashFunctions;

class HashConfigTest {

    @Test
    void testDefaults() {
        HashConfig config = HashConfig.DEFAULTS;

        assertThat(config.isTrackDescriptions()).isFalse();
        assertThat(config.isTrackFieldOrder()).isFalse();
        assertThat(config.isTrackTypeOrder()).isFalse();
        assertThat(config.isTrackValidationMode()).isTrue();
        assertThat(config.getTrackedExtraData()).isNull();
        assertThat(config.getHashLimit()).isEqualTo(HashLimit.of(12));
        assertThat(config.getTrackedFilepathParts()).isEqualTo(2);
        assertThat(config.getHashFunction()).isSameAs(HashFunctions.md5Hex());
    }

    @Test
    void testToSettingsCopiesTheFiveReportedFields() {
        HashConfig config = HashConfig.DEFAULTS.toBuilder()
                .trackDescriptions(true)
                .trackTypeOrder(true)
                .trackedFilepathParts(0)
                .build();

        HashSettings settings = config.toSettings();

        assertThat(settings.isTrackDescriptions()).isTrue();
        assertThat(settings.isTrackFieldOrder()).isFalse();
        assertThat(settings.isTrackTypeOrder()).isTrue();
        assertThat(settings.getTrackedFilepathParts()).isZero();
        assertThat(settings.isTrackValidationMode()).isTrue();
    }
}
