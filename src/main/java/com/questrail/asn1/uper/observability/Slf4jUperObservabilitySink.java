package com.questrail.asn1.uper.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of UperObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jUperObservabilitySink implements UperObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jUperObservabilitySink.class);

    @Override
    public void onEncoded(UperCodecEvent event) {
        log.debug("UPER encoded {}: {} bits", event.typeName(), event.bitLength());
    }

    @Override
    public void onDecoded(UperCodecEvent event) {
        log.debug("UPER decoded {}: {} bits", event.typeName(), event.bitLength());
    }

    @Override
    public void onError(UperErrorEvent event) {
        log.warn("UPER {} of {} failed: {}",
            event.direction(), event.typeName(), event.message(), event.cause());
    }
}
