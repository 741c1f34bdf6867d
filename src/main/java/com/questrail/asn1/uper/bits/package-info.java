/**
 * Bit-granular storage and cursors.
 *
 * <p>{@link com.questrail.asn1.uper.bits.BitBuffer} owns growable storage and
 * is used for encoding; {@link com.questrail.asn1.uper.bits.BitsView} borrows
 * an existing array for zero-copy decoding. Both number bits most-significant
 * first and fail with {@code END_OF_STREAM} when read past their end.</p>
 */
package com.questrail.asn1.uper.bits;
