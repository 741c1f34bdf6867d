package com.questrail.asn1.uper;

/**
 * What a field visit resolved to in the active scope.
 */
enum Slot
{
    /** Value is written or read in place. */
    PLAIN,

    /** Value is wrapped as a length-prefixed open type. */
    OPEN_TYPE,

    /** Presence bit is clear; nothing follows for this field. */
    ABSENT
}
