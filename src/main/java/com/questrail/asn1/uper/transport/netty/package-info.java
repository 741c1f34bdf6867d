/**
 * Netty pipeline adapters for the UPER codec.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g. {@code ByteBuf}, {@code ChannelHandlerContext}) MUST NOT
 * escape this package. Payloads are copied into {@code byte[]} before they are
 * handed to {@link com.questrail.asn1.uper.UperCodec}.
 */
package com.questrail.asn1.uper.transport.netty;
