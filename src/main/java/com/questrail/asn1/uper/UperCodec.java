package com.questrail.asn1.uper;

import com.questrail.asn1.descriptor.Asn1Type;
import com.questrail.asn1.uper.config.UperCodecConfig;
import com.questrail.asn1.uper.observability.CodecDirection;
import com.questrail.asn1.uper.observability.UperCodecEvent;
import com.questrail.asn1.uper.observability.UperErrorEvent;
import com.questrail.asn1.uper.observability.UperObservabilitySink;

import java.time.Instant;
import java.util.Objects;

/**
 * UperCodec
 * =============================================================================
 * Entry point for encoding and decoding whole values with the Unaligned
 * Packed Encoding Rules.
 *
 * <p>Each call creates its own {@link UperWriter} or {@link UperReader}, so a
 * single codec may be shared between threads.</p>
 *
 * <h2>What this does NOT do</h2>
 * <ul>
 *   <li>No framing: a message is exactly one encoded value.</li>
 *   <li>No recovery: any failure aborts the call; nothing partial is returned.</li>
 * </ul>
 *
 * <p>Every outcome is reported to the configured {@link UperObservabilitySink};
 * failures are reported and then rethrown unchanged.</p>
 */
public final class UperCodec
{
    private final UperCodecConfig config;

    public UperCodec()
    {
        this(UperCodecConfig.defaults());
    }

    public UperCodec(UperCodecConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    public UperCodecConfig config()
    {
        return config;
    }

    /**
     * @return the encoding, padded with zero bits to a whole byte
     */
    public <T> byte[] encode(T value, Asn1Type<T> type)
    {
        return encodeBits(value, type).bytes();
    }

    public <T> EncodedBits encodeBits(T value, Asn1Type<T> type)
    {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(type, "type");

        UperWriter writer = new UperWriter(config.initialCapacityBytes());
        try {
            writer.write(type, value);
        } catch (UperException e) {
            report(type, CodecDirection.ENCODE, e);
            throw e;
        }

        EncodedBits encoded = new EncodedBits(writer.toByteArray(), writer.bitLength());
        config.observabilitySink().onEncoded(
                new UperCodecEvent(Instant.now(), type.name(), CodecDirection.ENCODE, encoded.bitLength()));
        return encoded;
    }

    /**
     * Decode a value from the first {@code bitLength} bits of {@code bytes}.
     */
    public <T> T decode(byte[] bytes, int bitLength, Asn1Type<T> type)
    {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(type, "type");

        UperReader reader = new UperReader(bytes, bitLength, config.maxSequenceOfElements());
        T value;
        try {
            value = reader.read(type);
            int unread = reader.bitsRemaining();
            if (config.rejectTrailingData() && unread >= Byte.SIZE) {
                throw UperException.trailingData(unread);
            }
        } catch (UperException e) {
            report(type, CodecDirection.DECODE, e);
            throw e;
        }

        config.observabilitySink().onDecoded(new UperCodecEvent(
                Instant.now(), type.name(), CodecDirection.DECODE, bitLength - reader.bitsRemaining()));
        return value;
    }

    public <T> T decode(EncodedBits encoded, Asn1Type<T> type)
    {
        Objects.requireNonNull(encoded, "encoded");
        return decode(encoded.bytes(), encoded.bitLength(), type);
    }

    /**
     * Decode a value from all bits of {@code bytes}, for inputs whose exact bit
     * length is not known (e.g. a received datagram).
     */
    public <T> T decode(byte[] bytes, Asn1Type<T> type)
    {
        Objects.requireNonNull(bytes, "bytes");
        return decode(bytes, bytes.length * Byte.SIZE, type);
    }

    private void report(Asn1Type<?> type, CodecDirection direction, UperException e)
    {
        config.observabilitySink().onError(
                new UperErrorEvent(Instant.now(), type.name(), direction, e.getMessage(), e));
    }
}
