package com.questrail.asn1.uper.observability;

import java.time.Instant;

/**
 * Record representing a failed encode or decode.
 */
public record UperErrorEvent(
    Instant timestamp,
    String typeName,
    CodecDirection direction,
    String message,
    Throwable cause
) {
}
