package com.questrail.asn1.uper.observability;

/**
 * Direction of a codec operation.
 */
public enum CodecDirection {
    ENCODE,
    DECODE
}
