// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.event;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.credential.CredentialEvent;

/**
 * Receives credential events after the emitting operation has committed.
 *
 * <p>Sinks run inside the emitting operation. Instances and factories wrap their
 * sink with {@link #guarded(EventSink)}, so a failing sink never undoes or
 * interrupts a committed operation.
 */
@FunctionalInterface
public interface EventSink {

    void emit(CredentialEvent event);

    /**
     * Returns a sink that forwards to this sink, then to {@code next}.
     * {@code next} receives the event even if this sink throws.
     */
    default EventSink andThen(EventSink next) {
        Objects.requireNonNull(next, "next");
        return event -> {
            try {
                emit(event);
            } finally {
                next.emit(event);
            }
        };
    }

    /**
     * Returns a sink that forwards to {@code sink} and logs its failures at WARN
     * on logger {@code sh.tessera.events} instead of propagating them.
     */
    static EventSink guarded(EventSink sink) {
        Objects.requireNonNull(sink, "sink");
        Logger log = LoggerFactory.getLogger("sh.tessera.events");
        return event -> {
            try {
                sink.emit(event);
            } catch (RuntimeException e) {
                log.warn("Event sink failed for {} from {}",
                        event.getClass().getSimpleName(), event.source(), e);
            }
        };
    }

    /** A sink that drops every event. */
    static EventSink noop() {
        return event -> { };
    }

    /**
     * A sink that logs each event as JSON at DEBUG on logger {@code sh.tessera.events}.
     */
    static EventSink logging() {
        Logger log = LoggerFactory.getLogger("sh.tessera.events");
        return event -> {
            if (log.isDebugEnabled()) {
                log.debug("{}", EventJson.toJson(event));
            }
        };
    }
}
