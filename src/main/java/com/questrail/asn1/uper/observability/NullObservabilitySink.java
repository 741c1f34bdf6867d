package com.questrail.asn1.uper.observability;

/**
 * No-op implementation of UperObservabilitySink.
 */
public final class NullObservabilitySink implements UperObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onEncoded(UperCodecEvent event) {}

    @Override
    public void onDecoded(UperCodecEvent event) {}

    @Override
    public void onError(UperErrorEvent event) {}
}
