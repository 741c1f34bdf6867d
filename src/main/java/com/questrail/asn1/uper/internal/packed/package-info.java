/**
 * X.691 Packed Primitives
 * =============================================================================
 *
 * <p>Stateless encoders and decoders for the building blocks of UPER:</p>
 * <ul>
 *   <li>constrained, semi-constrained, unconstrained and normally small whole
 *       numbers (clause 11)</li>
 *   <li>length determinants, including fragmentation in units of 16K</li>
 *   <li>octet strings, bit strings and restricted character strings
 *       (clauses 16, 17 and 30)</li>
 *   <li>CHOICE and ENUMERATED indices</li>
 * </ul>
 *
 * <p>These classes know nothing about containers or presence bits; that is
 * the writer's and reader's job. They are public only so the facade package
 * can reach them and are not part of the supported API.</p>
 */
package com.questrail.asn1.uper.internal.packed;
