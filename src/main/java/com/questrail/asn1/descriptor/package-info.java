/**
 * Constraint descriptors and value types consumed by the codec.
 *
 * <p>Generated bindings build one immutable descriptor per ASN.1 type and pass
 * it with every value. Only PER-visible information is modelled.</p>
 */
package com.questrail.asn1.descriptor;
