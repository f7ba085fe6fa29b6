// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.credential.CredentialEvent;
import sh.tessera.core.credential.InstanceCreated;
import sh.tessera.core.error.AddressOccupiedException;
import sh.tessera.core.error.InvalidOwnerException;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.credential.event.EventSink;

/**
 * Stamps out credential instances from one shared template.
 *
 * <p>The factory deploys its template once, at construction. Every instance it
 * creates executes the template's logic with a private storage region, and is
 * initialized before it is placed in {@link Deployments}, so no caller can
 * reach an instance in the uninitialized state. Events are emitted only after
 * placement. The creating caller becomes the owner.
 *
 * <p>Two addressing modes:
 * <ul>
 * <li>{@link #create}: the address is unknown until the call returns.</li>
 * <li>{@link #createDeterministic}: the address is {@link #predictAddress(Hash)}
 * for the salt, computable by anyone beforehand. A salt can be used once.</li>
 * </ul>
 *
 * <p>Example:
 * <pre>{@code
 * InstanceFactory factory = InstanceFactory.deploy(deployments, deployer);
 * Hash salt = Keccak256.hashUtf8("widget-v1");
 * Address expected = factory.predictAddress(salt);
 * Address actual = factory.createDeterministic(creator, registry, "Widget", salt);
 * assert expected.equals(actual);
 * }</pre>
 */
public final class InstanceFactory {

    private static final Logger LOG = LoggerFactory.getLogger(InstanceFactory.class);

    private final Deployments deployments;
    private final Address address;
    private final CredentialInstance template;
    private final EventSink events;
    private final Hash cloneCodeHash;

    private final List<Address> instances = new ArrayList<>();
    private final Map<Address, List<Address>> instancesByCreator = new HashMap<>();
    private final Set<Address> created = new HashSet<>();

    private InstanceFactory(Deployments deployments, Address address, CredentialInstance template,
                            CredentialOptions options) {
        this.deployments = deployments;
        this.address = address;
        this.template = template;
        this.events = EventSink.guarded(options.eventSink());
        this.cloneCodeHash = CloneAddresses.cloneCodeHash(template.address());
    }

    /**
     * Deploys a factory and its template with default options.
     */
    public static InstanceFactory deploy(Deployments deployments, Address deployer) {
        return deploy(deployments, deployer, CredentialOptions.defaults());
    }

    /**
     * Deploys a factory and its template.
     *
     * @param deployments the address space
     * @param deployer    the deploying account
     * @param options     options handed to the template and every instance
     * @return the factory
     */
    public static InstanceFactory deploy(Deployments deployments, Address deployer, CredentialOptions options) {
        Objects.requireNonNull(deployments, "deployments");
        Objects.requireNonNull(deployer, "deployer");
        Objects.requireNonNull(options, "options");
        Address factoryAddress = deployments.freshAddress(deployer);
        Address templateAddress = deployments.freshAddress(factoryAddress);
        CredentialInstance template = deployments.deploy(
                templateAddress, CredentialInstance.template(templateAddress, deployments, options));
        InstanceFactory factory = deployments.deploy(
                factoryAddress, new InstanceFactory(deployments, factoryAddress, template, options));
        LOG.debug("Deployed factory {} with template {}", factoryAddress, templateAddress);
        return factory;
    }

    /**
     * Creates an instance at an unpredictable address.
     *
     * @param caller      the creator, who becomes the owner
     * @param registry    the registry; {@link Address#ZERO} selects the default registry
     * @param displayName optional name stored under the name key
     * @return the new instance's address
     * @throws InvalidOwnerException if caller is the zero address
     */
    public synchronized Address create(Address caller, Address registry, @Nullable String displayName) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(registry, "registry");
        requireCreator(caller);
        return createAt(deployments.freshAddress(address), caller, registry, displayName);
    }

    /**
     * Creates an instance at {@link #predictAddress(Hash) predictAddress(salt)}.
     *
     * @param caller      the creator, who becomes the owner
     * @param registry    the registry; {@link Address#ZERO} selects the default registry
     * @param displayName optional name stored under the name key
     * @param salt        caller-chosen salt
     * @return the new instance's address
     * @throws AddressOccupiedException if the salt was already used
     * @throws InvalidOwnerException    if caller is the zero address
     */
    public synchronized Address createDeterministic(
            Address caller, Address registry, @Nullable String displayName, Hash salt) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(salt, "salt");
        requireCreator(caller);
        Address target = predictAddress(salt);
        if (deployments.isOccupied(target)) {
            throw new AddressOccupiedException(target);
        }
        return createAt(target, caller, registry, displayName);
    }

    /**
     * Computes the address {@link #createDeterministic} produces for {@code salt}.
     * Depends only on this factory's address, the salt and the template.
     *
     * @param salt the salt
     * @return the predicted address
     */
    public Address predictAddress(Hash salt) {
        Objects.requireNonNull(salt, "salt");
        return CloneAddresses.create2(address, salt, cloneCodeHash);
    }

    private Address createAt(Address target, Address caller, Address registry, @Nullable String displayName) {
        CredentialInstance instance = CredentialInstance.cloneOf(template, target);
        // initialized before it becomes reachable through deployments
        List<CredentialEvent> initialized = instance.commitInitialization(registry, caller, displayName);
        deployments.deploy(target, instance);
        instance.publish(initialized);

        instances.add(target);
        instancesByCreator.computeIfAbsent(caller, k -> new ArrayList<>()).add(target);
        created.add(target);

        String name = displayName == null ? "" : displayName;
        LOG.debug("Created instance {} for {} (name='{}')", target, caller, name);
        events.emit(new InstanceCreated(address, target, instance.registry(), name, caller));
        return target;
    }

    private static void requireCreator(Address caller) {
        if (caller.isZero()) {
            throw new InvalidOwnerException();
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // Read-only projections
    // ═══════════════════════════════════════════════════════════════════

    /** All created instance addresses, oldest first. */
    public synchronized List<Address> allInstances() {
        return List.copyOf(instances);
    }

    /** Instances created by {@code creator}, oldest first; empty if none. */
    public synchronized List<Address> instancesOf(Address creator) {
        Objects.requireNonNull(creator, "creator");
        return List.copyOf(instancesByCreator.getOrDefault(creator, List.of()));
    }

    public synchronized int instanceCount() {
        return instances.size();
    }

    public synchronized int instanceCountOf(Address creator) {
        Objects.requireNonNull(creator, "creator");
        return instancesByCreator.getOrDefault(creator, List.of()).size();
    }

    /** Whether {@code candidate} was created by this factory. */
    public synchronized boolean isFactoryInstance(Address candidate) {
        Objects.requireNonNull(candidate, "candidate");
        return created.contains(candidate);
    }

    /**
     * Looks up an instance created by this factory.
     *
     * @return the instance, or empty if {@code instanceAddress} did not come from this factory
     */
    public Optional<CredentialInstance> instance(Address instanceAddress) {
        if (!isFactoryInstance(instanceAddress)) {
            return Optional.empty();
        }
        return deployments.lookup(instanceAddress, CredentialInstance.class);
    }

    public Address address() {
        return address;
    }

    /** The shared template every instance executes. */
    public CredentialInstance template() {
        return template;
    }

    /** Code identity of every clone this factory creates. */
    public Hash cloneCodeHash() {
        return cloneCodeHash;
    }
}
