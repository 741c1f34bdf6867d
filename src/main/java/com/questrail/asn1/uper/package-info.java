/**
 * UPER Codec
 * =============================================================================
 *
 * <p>This package is the public face of the <strong>Unaligned Packed Encoding
 * Rules</strong> runtime (ITU-T X.691, unaligned variant). It turns values
 * described by {@link com.questrail.asn1.descriptor.Asn1Type} descriptors into
 * bit-exact encodings and back.</p>
 *
 * <h2>Normative Authority</h2>
 * <p><strong>ITU-T X.691</strong> defines every wire rule implemented here:
 * whole numbers, length determinants and fragmentation, presence bitmaps,
 * extension markers and open types. Nothing in this package pads to a byte
 * boundary; only the final encoding is padded to whole bytes.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   value + Asn1Type
 *        → UperCodec             (one call per message, observability)
 *            → UperWriter / UperReader   (scope state machine, open types)
 *                → internal.packed       (X.691 primitives)
 *                    → bits              (bit cursors over byte storage)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Schemas are not parsed or validated here; descriptors are trusted to
 *       describe the type correctly.</li>
 *   <li>Encoded messages carry no framing. Message boundaries belong to the
 *       transport.</li>
 *   <li>All failures are {@link com.questrail.asn1.uper.UperException}s and are
 *       never retried.</li>
 * </ul>
 */
package com.questrail.asn1.uper;
