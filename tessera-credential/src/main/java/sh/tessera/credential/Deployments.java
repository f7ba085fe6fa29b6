// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.error.AddressOccupiedException;
import sh.tessera.core.types.Address;
import sh.tessera.credential.auth.RegistryResolver;
import sh.tessera.credential.auth.SubjectRegistry;
import sh.tessera.primitives.Words;

/**
 * Address space holding every deployed instance, factory and registry.
 *
 * <p>Each address holds at most one object for the lifetime of the space.
 * Deploying to an occupied address fails. Also serves as the
 * {@link RegistryResolver} instances use to find their bound registry.
 */
public final class Deployments implements RegistryResolver {

    private static final Logger LOG = LoggerFactory.getLogger(Deployments.class);

    private final Map<Address, Object> deployed = new ConcurrentHashMap<>();
    private final AtomicLong nonce = new AtomicLong();
    private final SecureRandom random = new SecureRandom();

    /**
     * Places {@code target} at {@code address}.
     *
     * @return {@code target}
     * @throws AddressOccupiedException if the address already holds something
     * @throws IllegalArgumentException if address is the zero address
     */
    public <T> T deploy(Address address, T target) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(target, "target");
        if (address.isZero()) {
            throw new IllegalArgumentException("Cannot deploy to the zero address");
        }
        if (deployed.putIfAbsent(address, target) != null) {
            throw new AddressOccupiedException(address);
        }
        LOG.debug("Deployed {} at {}", target.getClass().getSimpleName(), address);
        return target;
    }

    /**
     * Convenience for placing a registry at a fresh address.
     *
     * @return the address the registry now lives at
     */
    public Address deployRegistry(Address deployer, SubjectRegistry registry) {
        Address address = freshAddress(deployer);
        deploy(address, registry);
        return address;
    }

    /**
     * Derives an unused address no caller can compute in advance.
     *
     * @param deployer the deploying account
     * @return an unoccupied address
     */
    public Address freshAddress(Address deployer) {
        Objects.requireNonNull(deployer, "deployer");
        while (true) {
            byte[] entropy = new byte[16];
            random.nextBytes(entropy);
            byte[] digest = Keccak256.hash(
                    deployer.toBytes(),
                    Words.uint256(BigInteger.valueOf(nonce.getAndIncrement())),
                    entropy);
            Address candidate = Address.fromBytes(Arrays.copyOfRange(digest, 12, 32));
            if (!candidate.isZero() && !deployed.containsKey(candidate)) {
                return candidate;
            }
        }
    }

    public boolean isOccupied(Address address) {
        Objects.requireNonNull(address, "address");
        return deployed.containsKey(address);
    }

    /**
     * @return the object at {@code address} if it is a {@code type}
     */
    public <T> Optional<T> lookup(Address address, Class<T> type) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(type, "type");
        Object target = deployed.get(address);
        return type.isInstance(target) ? Optional.of(type.cast(target)) : Optional.empty();
    }

    @Override
    public Optional<SubjectRegistry> resolve(Address address) {
        return lookup(address, SubjectRegistry.class);
    }
}
