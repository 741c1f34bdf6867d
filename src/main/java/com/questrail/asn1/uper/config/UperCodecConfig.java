package com.questrail.asn1.uper.config;

import com.questrail.asn1.uper.observability.NullObservabilitySink;
import com.questrail.asn1.uper.observability.UperObservabilitySink;

import java.util.Objects;

/**
 * UperCodecConfig
 * -----------------------------------------------------------------------------
 * Operational configuration of a {@code UperCodec}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>initialCapacityBytes</b> - initial size of the encode buffer. The
 *       buffer grows as needed; this only avoids early reallocation.</li>
 *   <li><b>rejectTrailingData</b> - fail a decode that leaves at least one whole
 *       unread octet behind. Fewer than eight unread bits are padding and are
 *       always accepted.</li>
 *   <li><b>dropMalformedMessages</b> - used by transport adapters: report and
 *       drop an inbound message that fails to decode instead of propagating the
 *       failure into the pipeline.</li>
 *   <li><b>maxSequenceOfElements</b> - upper limit on the element count of a
 *       decoded SEQUENCE OF. Elements without content (NULL, empty sequences)
 *       cost no input bits, so a few fragment headers could otherwise announce
 *       billions of them.</li>
 *   <li><b>observabilitySink</b> - receives encode, decode and error events.</li>
 * </ul>
 *
 * <p>None of these parameters change the wire format.</p>
 */
public record UperCodecConfig(
    int initialCapacityBytes,
    boolean rejectTrailingData,
    boolean dropMalformedMessages,
    int maxSequenceOfElements,
    UperObservabilitySink observabilitySink
) {
    public static final int DEFAULT_MAX_SEQUENCE_OF_ELEMENTS = 1 << 20;

    public UperCodecConfig {
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        if (initialCapacityBytes <= 0) {
            throw new IllegalArgumentException("initialCapacityBytes must be positive");
        }
        if (maxSequenceOfElements < 0) {
            throw new IllegalArgumentException("maxSequenceOfElements must be non-negative");
        }
    }

    public static UperCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int initialCapacityBytes = 64;
        private boolean rejectTrailingData = false;
        private boolean dropMalformedMessages = true;
        private int maxSequenceOfElements = DEFAULT_MAX_SEQUENCE_OF_ELEMENTS;
        private UperObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withInitialCapacityBytes(int initialCapacityBytes) {
            this.initialCapacityBytes = initialCapacityBytes;
            return this;
        }

        public Builder withRejectTrailingData(boolean rejectTrailingData) {
            this.rejectTrailingData = rejectTrailingData;
            return this;
        }

        public Builder withDropMalformedMessages(boolean dropMalformedMessages) {
            this.dropMalformedMessages = dropMalformedMessages;
            return this;
        }

        public Builder withMaxSequenceOfElements(int maxSequenceOfElements) {
            this.maxSequenceOfElements = maxSequenceOfElements;
            return this;
        }

        public Builder withObservabilitySink(UperObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public UperCodecConfig build() {
            return new UperCodecConfig(initialCapacityBytes, rejectTrailingData,
                dropMalformedMessages, maxSequenceOfElements, observabilitySink);
        }
    }
}
