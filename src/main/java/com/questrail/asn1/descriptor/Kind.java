package com.questrail.asn1.descriptor;

/**
 * Semantic kind of an ASN.1 type as seen by the packed encoder.
 */
public enum Kind
{
    BOOLEAN,
    NULL,
    INTEGER,
    ENUMERATED,
    OCTET_STRING,
    BIT_STRING,
    CHARACTER_STRING,
    SEQUENCE,
    SET,
    SEQUENCE_OF,
    SET_OF,
    CHOICE
}
