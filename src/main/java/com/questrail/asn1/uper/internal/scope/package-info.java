/**
 * Presence-bit scope state machine used by the UPER writer and reader.
 */
package com.questrail.asn1.uper.internal.scope;
