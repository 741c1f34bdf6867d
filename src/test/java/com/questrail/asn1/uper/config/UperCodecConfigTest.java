package com.questrail.asn1.uper.config;

import com.questrail.asn1.uper.observability.NullObservabilitySink;
import com.questrail.asn1.uper.observability.Slf4jUperObservabilitySink;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class UperCodecConfigTest {

    @Test
    void defaultsAreLenientAndSilent() {
        UperCodecConfig config = UperCodecConfig.defaults();

        assertEquals(64, config.initialCapacityBytes());
        assertFalse(config.rejectTrailingData());
        assertTrue(config.dropMalformedMessages());
        assertEquals(1 << 20, config.maxSequenceOfElements());
        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
    }

    @Test
    void builderOverridesEverySetting() {
        Slf4jUperObservabilitySink sink = new Slf4jUperObservabilitySink();
        UperCodecConfig config = UperCodecConfig.builder()
            .withInitialCapacityBytes(8)
            .withRejectTrailingData(true)
            .withDropMalformedMessages(false)
            .withMaxSequenceOfElements(1000)
            .withObservabilitySink(sink)
            .build();

        assertEquals(8, config.initialCapacityBytes());
        assertTrue(config.rejectTrailingData());
        assertFalse(config.dropMalformedMessages());
        assertEquals(1000, config.maxSequenceOfElements());
        assertSame(sink, config.observabilitySink());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
            () -> UperCodecConfig.builder().withInitialCapacityBytes(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> UperCodecConfig.builder().withMaxSequenceOfElements(-1).build());
        assertThrows(NullPointerException.class,
            () -> UperCodecConfig.builder().withObservabilitySink(null).build());
    }
}
