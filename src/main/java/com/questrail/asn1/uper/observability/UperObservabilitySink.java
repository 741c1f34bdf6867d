package com.questrail.asn1.uper.observability;

/**
 * Interface for observing codec activity.
 *
 * <p>Implementations must not throw; they are invoked on the caller's thread
 * in the middle of an encode or decode call.</p>
 */
public interface UperObservabilitySink {

    void onEncoded(UperCodecEvent event);

    void onDecoded(UperCodecEvent event);

    void onError(UperErrorEvent event);
}
