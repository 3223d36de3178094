package com.frenchtoast.alert.diagnostic;

import com.frenchtoast.alert.core.model.DiagnosticEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Sink for {@link DiagnosticEvent}s. Failure events go out at WARN, bookkeeping events such as
 * a new subscriber at INFO.
 */
@Component
public class DiagnosticEventLogger {

    private static final Logger log = LoggerFactory.getLogger("diagnostics");

    private static final Set<String> INFORMATIONAL = Set.of(
            DiagnosticEvent.SUBSCRIBER_ADDED,
            DiagnosticEvent.SUBSCRIBER_UPDATED);

    @EventListener
    public void onDiagnostic(DiagnosticEvent event) {
        if (INFORMATIONAL.contains(event.name())) {
            log.info("diagnostic event={} payload={}", event.name(), event.payload());
        } else {
            log.warn("diagnostic event={} payload={}", event.name(), event.payload());
        }
    }
}
