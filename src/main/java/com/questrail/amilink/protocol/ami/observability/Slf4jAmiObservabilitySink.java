package com.questrail.amilink.protocol.ami.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production sink that reports through SLF4J.
 *
 * <p>Gaining or losing {@code READY} is logged at INFO, intermediate
 * transitions at DEBUG, absorbed errors at WARN with their cause.</p>
 */
public final class Slf4jAmiObservabilitySink implements AmiObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jAmiObservabilitySink.class);

    @Override
    public void onStateTransition(AmiConnectionTransitionEvent event) {
        if (event.becameReady() || event.lostReady()) {
            log.info("AMI connection #{}: {} -> {} ({})",
                event.generation(), event.oldState(), event.newState(), event.reason());
        } else {
            log.debug("AMI connection #{}: {} -> {} ({})",
                event.generation(), event.oldState(), event.newState(), event.reason());
        }
    }

    @Override
    public void onError(AmiErrorEvent event) {
        log.warn("AMI: {}", event.message(), event.cause());
    }
}
