package com.questrail.asn1.descriptor;

/**
 * The single value of the ASN.1 {@code NULL} type.
 */
public enum Null
{
    INSTANCE
}
