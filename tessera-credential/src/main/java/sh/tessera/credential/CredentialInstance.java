// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.credential.CredentialEvent;
import sh.tessera.core.credential.InterfaceId;
import sh.tessera.core.credential.MetadataChanged;
import sh.tessera.core.credential.MetadataEntry;
import sh.tessera.core.credential.OwnershipTransferred;
import sh.tessera.core.credential.RegistryUpdated;
import sh.tessera.core.credential.ReviewSubmitted;
import sh.tessera.core.credential.SubjectId;
import sh.tessera.core.error.AgentNotFoundException;
import sh.tessera.core.error.AlreadyInitializedException;
import sh.tessera.core.error.InvalidOwnerException;
import sh.tessera.core.error.InvalidRegistryException;
import sh.tessera.core.error.NotAuthorizedException;
import sh.tessera.core.error.ReviewerNotAgentException;
import sh.tessera.core.types.Address;
import sh.tessera.credential.auth.AuthorizationGate;
import sh.tessera.credential.auth.AuthorizationResult;
import sh.tessera.credential.auth.RegistryResolver;
import sh.tessera.credential.event.EventSink;
import sh.tessera.credential.store.KeyCodec;
import sh.tessera.credential.store.Namespace;
import sh.tessera.credential.store.NamespacedStore;
import sh.tessera.credential.store.StorageRegion;
import sh.tessera.primitives.Words;

/**
 * A credential store owned by one account and bound to one subject registry.
 *
 * <p>Every instance runs the same logic against its own {@link StorageRegion}.
 * Subject metadata, instance metadata and reviews each live in a separate
 * {@link Namespace}, whose slots are computed from constants shared by all
 * instances; data written to one instance is never visible through another.
 *
 * <p>Instances come from two places:
 * <ul>
 * <li>{@link #deploy}: created initialized, bound to an owner and registry.</li>
 * <li>{@link InstanceFactory}: cloned from the factory's template in the
 * {@link InstanceState#UNINITIALIZED} state, then initialized exactly once.</li>
 * </ul>
 * The template itself is created in {@link InstanceState#TEMPLATE} and rejects
 * {@link #initialize} forever.
 *
 * <p>Operations that write are {@code synchronized}: each one is atomic and
 * totally ordered with every other write on the same instance. All checks run
 * before the first write, so a rejected call leaves no trace and emits no
 * events. The calling account is passed explicitly as {@code caller}.
 *
 * <p>Example:
 * <pre>{@code
 * CredentialInstance credentials = CredentialInstance.deploy(deployments, owner, registryAddress);
 * credentials.setSubjectMetadata(subjectOwner, subject, "role", "auditor".getBytes(UTF_8));
 * byte[] role = credentials.getSubjectMetadata(subject, "role");
 * }</pre>
 */
public final class CredentialInstance
        implements SubjectMetadata, InstanceMetadata, Reviews, CredentialOperations, SupportsInterface {

    private static final Logger LOG = LoggerFactory.getLogger(CredentialInstance.class);

    /** Namespace of per-subject metadata. */
    public static final Namespace SUBJECT_METADATA_NAMESPACE = Namespace.of("tessera.credential.subject-metadata.v1");

    /** Namespace of instance-level metadata. */
    public static final Namespace INSTANCE_METADATA_NAMESPACE = Namespace.of("tessera.credential.instance-metadata.v1");

    /** Namespace of reviewer/reviewed pair data. */
    public static final Namespace REVIEWS_NAMESPACE = Namespace.of("tessera.credential.reviews.v1");

    private record SubjectKey(SubjectId subjectId, String key) {}

    private record ReviewKey(SubjectId reviewerId, SubjectId reviewedId) {}

    // fixed-width id first, variable-width key last
    private static final NamespacedStore<SubjectKey> SUBJECT_METADATA = new NamespacedStore<>(
            SUBJECT_METADATA_NAMESPACE,
            k -> Words.concat(k.subjectId().toWord(), k.key().getBytes(StandardCharsets.UTF_8)));

    private static final NamespacedStore<String> INSTANCE_METADATA = new NamespacedStore<>(
            INSTANCE_METADATA_NAMESPACE, KeyCodec.utf8());

    private static final NamespacedStore<ReviewKey> REVIEWS = new NamespacedStore<>(
            REVIEWS_NAMESPACE,
            k -> Words.concat(k.reviewerId().toWord(), k.reviewedId().toWord()));

    private final Address address;
    private final Address implementation;
    private final StorageRegion storage;
    private final AuthorizationGate gate;
    private final CredentialOptions options;
    private final EventSink events;

    private volatile InstanceState state;
    private volatile Address owner = Address.ZERO;
    private volatile Address registry = Address.ZERO;

    private CredentialInstance(
            Address address,
            Address implementation,
            InstanceState state,
            AuthorizationGate gate,
            CredentialOptions options) {
        this.address = address;
        this.implementation = implementation;
        this.state = state;
        this.gate = gate;
        this.options = options;
        this.events = EventSink.guarded(options.eventSink());
        this.storage = new StorageRegion(address);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Construction
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Deploys an initialized instance with default options.
     *
     * @see #deploy(Deployments, Address, Address, CredentialOptions)
     */
    public static CredentialInstance deploy(Deployments deployments, Address owner, Address registry) {
        return deploy(deployments, owner, registry, CredentialOptions.defaults());
    }

    /**
     * Deploys an instance bound to {@code owner} and {@code registry} at a fresh address.
     *
     * @param deployments the address space to deploy into
     * @param owner       the owner
     * @param registry    the registry; {@link Address#ZERO} selects {@link CredentialOptions#defaultRegistry()}
     * @param options     options for the instance
     * @return the deployed instance
     * @throws InvalidOwnerException if owner is the zero address
     */
    public static CredentialInstance deploy(
            Deployments deployments, Address owner, Address registry, CredentialOptions options) {
        Objects.requireNonNull(deployments, "deployments");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(options, "options");
        if (owner.isZero()) {
            throw new InvalidOwnerException();
        }
        Address at = deployments.freshAddress(owner);
        CredentialInstance instance = new CredentialInstance(
                at, at, InstanceState.UNINITIALIZED, new AuthorizationGate(deployments), options);
        List<CredentialEvent> initialized = instance.commitInitialization(registry, owner, null);
        deployments.deploy(at, instance);
        instance.publish(initialized);
        return instance;
    }

    /**
     * Creates the shared template at {@code address}. It never leaves the
     * {@link InstanceState#TEMPLATE} state.
     */
    static CredentialInstance template(Address address, RegistryResolver resolver, CredentialOptions options) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(resolver, "resolver");
        Objects.requireNonNull(options, "options");
        return new CredentialInstance(
                address, address, InstanceState.TEMPLATE, new AuthorizationGate(resolver), options);
    }

    /**
     * Creates an uninitialized clone of {@code template} at {@code address}
     * with its own empty storage region.
     */
    static CredentialInstance cloneOf(CredentialInstance template, Address address) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(address, "address");
        if (template.state != InstanceState.TEMPLATE) {
            throw new IllegalArgumentException(template.address + " is not a template");
        }
        return new CredentialInstance(
                address, template.address, InstanceState.UNINITIALIZED, template.gate, template.options);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════════

    @Override
    public synchronized void initialize(Address registry, Address owner, @Nullable String displayName) {
        publish(commitInitialization(registry, owner, displayName));
    }

    /**
     * Applies {@link #initialize} without emitting anything, so the creator can
     * finish initializing an instance before publishing it in {@link Deployments}.
     *
     * @return the events to hand to {@link #publish} once the instance is reachable
     */
    synchronized List<CredentialEvent> commitInitialization(
            Address registry, Address owner, @Nullable String displayName) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(owner, "owner");
        if (state == InstanceState.TEMPLATE) {
            throw new AlreadyInitializedException("Template " + address + " can never be initialized");
        }
        if (state == InstanceState.INITIALIZED) {
            throw new AlreadyInitializedException("Instance " + address + " is already initialized");
        }
        if (owner.isZero()) {
            throw new InvalidOwnerException();
        }

        Address bound = registry.isZero() ? options.defaultRegistry() : registry;
        this.state = InstanceState.INITIALIZED;
        this.registry = bound;
        this.owner = owner;
        boolean named = displayName != null && !displayName.isEmpty();
        byte[] name = named ? displayName.getBytes(StandardCharsets.UTF_8) : null;
        if (named) {
            INSTANCE_METADATA.set(storage, options.nameKey(), name);
        }

        LOG.debug("Initialized {} owner={} registry={}", address, owner, bound);
        List<CredentialEvent> committed = new ArrayList<>(3);
        committed.add(new RegistryUpdated(address, Address.ZERO, bound));
        committed.add(new OwnershipTransferred(address, Address.ZERO, owner));
        if (named) {
            committed.add(new MetadataChanged(address, null, options.nameKey(), name));
        }
        return committed;
    }

    void publish(List<CredentialEvent> committed) {
        for (CredentialEvent event : committed) {
            emit(event);
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // Subject metadata
    // ═══════════════════════════════════════════════════════════════════

    @Override
    public synchronized void setSubjectMetadata(Address caller, SubjectId subjectId, String key, byte[] value) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        authorizeSubject(caller, subjectId);
        SUBJECT_METADATA.set(storage, new SubjectKey(subjectId, key), value);
        emit(new MetadataChanged(address, subjectId, key, value));
    }

    @Override
    public synchronized void setSubjectMetadata(Address caller, SubjectId subjectId, List<MetadataEntry> entries) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(entries, "entries");
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("entries must not be empty");
        }
        List<MetadataEntry> batch = List.copyOf(entries);
        authorizeSubject(caller, subjectId);
        for (MetadataEntry entry : batch) {
            SUBJECT_METADATA.set(storage, new SubjectKey(subjectId, entry.key()), entry.value());
        }
        for (MetadataEntry entry : batch) {
            emit(new MetadataChanged(address, subjectId, entry.key(), entry.value()));
        }
    }

    @Override
    public byte[] getSubjectMetadata(SubjectId subjectId, String key) {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(key, "key");
        return SUBJECT_METADATA.get(storage, new SubjectKey(subjectId, key));
    }

    // ═══════════════════════════════════════════════════════════════════
    // Reviews
    // ═══════════════════════════════════════════════════════════════════

    @Override
    public synchronized void submitReview(Address caller, SubjectId reviewerId, SubjectId reviewedId, byte[] data) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(reviewerId, "reviewerId");
        Objects.requireNonNull(reviewedId, "reviewedId");
        Objects.requireNonNull(data, "data");
        AuthorizationResult result = gate.authorize(registry, caller, reviewerId);
        switch (result) {
            case AUTHORIZED -> { }
            case NOT_FOUND -> throw new ReviewerNotAgentException(reviewerId.value());
            case FORBIDDEN -> throw new NotAuthorizedException(caller,
                    "Caller " + caller + " may not review on behalf of subject " + reviewerId.value());
            default -> throw new IllegalStateException("Unexpected authorization result: " + result);
        }
        REVIEWS.set(storage, new ReviewKey(reviewerId, reviewedId), data);
        emit(new ReviewSubmitted(address, reviewerId, reviewedId, data));
    }

    @Override
    public byte[] getReview(SubjectId reviewerId, SubjectId reviewedId) {
        Objects.requireNonNull(reviewerId, "reviewerId");
        Objects.requireNonNull(reviewedId, "reviewedId");
        return REVIEWS.get(storage, new ReviewKey(reviewerId, reviewedId));
    }

    // ═══════════════════════════════════════════════════════════════════
    // Instance metadata and ownership
    // ═══════════════════════════════════════════════════════════════════

    @Override
    public synchronized void setInstanceMetadata(Address caller, String key, byte[] value) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        requireOwner(caller);
        INSTANCE_METADATA.set(storage, key, value);
        emit(new MetadataChanged(address, null, key, value));
    }

    @Override
    public byte[] getInstanceMetadata(String key) {
        Objects.requireNonNull(key, "key");
        return INSTANCE_METADATA.get(storage, key);
    }

    @Override
    public synchronized void setRegistry(Address caller, Address newRegistry) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(newRegistry, "newRegistry");
        requireOwner(caller);
        if (newRegistry.isZero()) {
            throw new InvalidRegistryException();
        }
        Address previous = registry;
        registry = newRegistry;
        LOG.debug("Registry of {} changed {} -> {}", address, previous, newRegistry);
        emit(new RegistryUpdated(address, previous, newRegistry));
    }

    @Override
    public Address registry() {
        return registry;
    }

    @Override
    public Address owner() {
        return owner;
    }

    @Override
    public synchronized void transferOwnership(Address caller, Address newOwner) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(newOwner, "newOwner");
        requireOwner(caller);
        if (newOwner.isZero()) {
            throw new InvalidOwnerException();
        }
        Address previous = owner;
        owner = newOwner;
        emit(new OwnershipTransferred(address, previous, newOwner));
    }

    @Override
    public synchronized void renounceOwnership(Address caller) {
        Objects.requireNonNull(caller, "caller");
        requireOwner(caller);
        Address previous = owner;
        owner = Address.ZERO;
        LOG.debug("Ownership of {} renounced by {}", address, previous);
        emit(new OwnershipTransferred(address, previous, Address.ZERO));
    }

    // ═══════════════════════════════════════════════════════════════════
    // Introspection
    // ═══════════════════════════════════════════════════════════════════

    @Override
    public boolean supportsInterface(InterfaceId interfaceId) {
        Objects.requireNonNull(interfaceId, "interfaceId");
        // 0xffffffff is never supported
        if (InterfaceId.INVALID.equals(interfaceId)) {
            return false;
        }
        return Capability.fromInterfaceId(interfaceId)
                .map(capability -> capability.type().isInstance(this))
                .orElse(false);
    }

    /**
     * @return every capability this instance declares
     */
    public Set<Capability> capabilities() {
        return Capability.declaredBy(this);
    }

    public Address address() {
        return address;
    }

    /**
     * Address of the template whose logic this instance executes; its own
     * address for templates and directly deployed instances.
     */
    public Address implementation() {
        return implementation;
    }

    public InstanceState state() {
        return state;
    }

    /**
     * The instance's private storage. Listeners attached here observe every slot write.
     */
    public StorageRegion storage() {
        return storage;
    }

    @Override
    public String toString() {
        return "CredentialInstance{"
                + "address=" + address
                + ", implementation=" + implementation
                + ", state=" + state
                + ", owner=" + owner
                + ", registry=" + registry
                + '}';
    }

    // ═══════════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════════

    private void authorizeSubject(Address caller, SubjectId subjectId) {
        AuthorizationResult result = gate.authorize(registry, caller, subjectId);
        switch (result) {
            case AUTHORIZED -> { }
            case NOT_FOUND -> throw new AgentNotFoundException(subjectId.value());
            case FORBIDDEN -> throw new NotAuthorizedException(caller,
                    "Caller " + caller + " may not act for subject " + subjectId.value());
            default -> throw new IllegalStateException("Unexpected authorization result: " + result);
        }
    }

    private void requireOwner(Address caller) {
        Address current = owner;
        if (current.isZero() || !current.equals(caller)) {
            throw new NotAuthorizedException(caller, "Caller " + caller + " is not the owner of " + address);
        }
    }

    private void emit(CredentialEvent event) {
        events.emit(event);
    }
}
