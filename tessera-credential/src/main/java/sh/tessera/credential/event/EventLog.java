// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import sh.tessera.core.credential.CredentialEvent;
import sh.tessera.core.types.Address;

/**
 * Append-only, in-memory {@link EventSink} for indexers and tests.
 */
public final class EventLog implements EventSink {

    private final List<CredentialEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void emit(CredentialEvent event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    /** All events in emission order. */
    public List<CredentialEvent> events() {
        return List.copyOf(events);
    }

    /** Events of one type, in emission order. */
    public <E extends CredentialEvent> List<E> eventsOfType(Class<E> type) {
        Objects.requireNonNull(type, "type");
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    /** Events emitted by {@code source}, in emission order. */
    public List<CredentialEvent> eventsFrom(Address source) {
        Objects.requireNonNull(source, "source");
        return events.stream().filter(e -> e.source().equals(source)).collect(Collectors.toList());
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
