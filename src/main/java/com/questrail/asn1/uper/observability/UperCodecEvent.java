package com.questrail.asn1.uper.observability;

import java.time.Instant;

/**
 * Record describing one successful encode or decode.
 *
 * @param bitLength bits produced (encode) or consumed (decode)
 */
public record UperCodecEvent(
    Instant timestamp,
    String typeName,
    CodecDirection direction,
    int bitLength
) {
}
