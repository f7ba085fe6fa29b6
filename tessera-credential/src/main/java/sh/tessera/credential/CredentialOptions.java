// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import java.util.Objects;

import sh.tessera.core.credential.TesseraAddresses;
import sh.tessera.core.types.Address;
import sh.tessera.credential.event.EventSink;

/**
 * Configuration shared by credential instances and the factories that create them.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * var events = new EventLog();
 * var options = CredentialOptions.builder()
 *     .defaultRegistry(myRegistry)
 *     .eventSink(events)
 *     .build();
 * InstanceFactory factory = InstanceFactory.deploy(deployments, deployer, options);
 * }</pre>
 */
public final class CredentialOptions {

    /** Default reserved instance-metadata key for the display name. */
    public static final String DEFAULT_NAME_KEY = "name";

    private static final CredentialOptions DEFAULTS = new CredentialOptions(
            TesseraAddresses.DEFAULT_REGISTRY,
            EventSink.logging(),
            DEFAULT_NAME_KEY);

    private final Address defaultRegistry;
    private final EventSink eventSink;
    private final String nameKey;

    private CredentialOptions(final Address defaultRegistry, final EventSink eventSink, final String nameKey) {
        this.defaultRegistry = defaultRegistry;
        this.eventSink = eventSink;
        this.nameKey = nameKey;
    }

    /**
     * Returns the shared defaults: {@link TesseraAddresses#DEFAULT_REGISTRY},
     * a logging event sink and the {@code "name"} key.
     *
     * @return default options
     */
    public static CredentialOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registry substituted for {@link Address#ZERO} at construction and initialization.
     *
     * @return the default registry address
     */
    public Address defaultRegistry() {
        return defaultRegistry;
    }

    /**
     * Sink receiving every event instances and factories emit.
     *
     * @return the event sink
     */
    public EventSink eventSink() {
        return eventSink;
    }

    /**
     * Instance-metadata key the display name is stored under.
     *
     * @return the name key
     */
    public String nameKey() {
        return nameKey;
    }

    @Override
    public String toString() {
        return "CredentialOptions{"
                + "defaultRegistry=" + defaultRegistry
                + ", nameKey=" + nameKey
                + '}';
    }

    /**
     * Builder for {@link CredentialOptions}.
     */
    public static final class Builder {
        private Address defaultRegistry = TesseraAddresses.DEFAULT_REGISTRY;
        private EventSink eventSink = DEFAULTS.eventSink;
        private String nameKey = DEFAULT_NAME_KEY;

        private Builder() {
        }

        /**
         * @throws NullPointerException     if defaultRegistry is null
         * @throws IllegalArgumentException if defaultRegistry is the zero address
         */
        public Builder defaultRegistry(final Address defaultRegistry) {
            Objects.requireNonNull(defaultRegistry, "defaultRegistry must not be null");
            if (defaultRegistry.isZero()) {
                throw new IllegalArgumentException("defaultRegistry must not be the zero address");
            }
            this.defaultRegistry = defaultRegistry;
            return this;
        }

        public Builder eventSink(final EventSink eventSink) {
            this.eventSink = Objects.requireNonNull(eventSink, "eventSink must not be null");
            return this;
        }

        /**
         * @throws IllegalArgumentException if nameKey is empty
         */
        public Builder nameKey(final String nameKey) {
            Objects.requireNonNull(nameKey, "nameKey must not be null");
            if (nameKey.isEmpty()) {
                throw new IllegalArgumentException("nameKey must not be empty");
            }
            this.nameKey = nameKey;
            return this;
        }

        public CredentialOptions build() {
            return new CredentialOptions(defaultRegistry, eventSink, nameKey);
        }
    }
}
