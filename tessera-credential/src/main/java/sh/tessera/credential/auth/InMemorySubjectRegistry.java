// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.auth;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import sh.tessera.core.credential.SubjectId;
import sh.tessera.core.error.RegistryException;
import sh.tessera.core.types.Address;

/**
 * Reference {@link SubjectRegistry} held in memory.
 *
 * <p>Subjects are numbered from 1 in registration order. Owners may grant
 * reusable operator standing or single-subject approvals. Suitable for tests
 * and local setups; production registries live outside this library.
 *
 * <p>Thread-safe. Approval consumption is a single atomic map removal.
 */
public final class InMemorySubjectRegistry implements SubjectRegistry {

    private record Approval(Address owner, Address actor, BigInteger subjectId) {}

    private record OperatorGrant(Address owner, Address operator) {}

    private final Map<BigInteger, Address> owners = new ConcurrentHashMap<>();
    private final Set<OperatorGrant> operators = ConcurrentHashMap.newKeySet();
    private final Map<Approval, BigInteger> approvals = new ConcurrentHashMap<>();
    private BigInteger nextId = BigInteger.ONE;

    /**
     * Registers a new subject owned by {@code owner}.
     *
     * @param owner the initial owner
     * @return the assigned id
     */
    public synchronized SubjectId register(Address owner) {
        requireOwner(owner);
        while (owners.containsKey(nextId)) {
            nextId = nextId.add(BigInteger.ONE);
        }
        SubjectId id = new SubjectId(nextId);
        owners.put(nextId, owner);
        nextId = nextId.add(BigInteger.ONE);
        return id;
    }

    /**
     * Registers a subject under an explicit id.
     *
     * @throws RegistryException if the id is taken
     */
    public synchronized SubjectId register(Address owner, SubjectId subjectId) {
        requireOwner(owner);
        Objects.requireNonNull(subjectId, "subjectId");
        if (owners.putIfAbsent(subjectId.value(), owner) != null) {
            throw new RegistryException("Subject already registered: " + subjectId.value());
        }
        return subjectId;
    }

    @Override
    public Address ownerOf(SubjectId subjectId) {
        Objects.requireNonNull(subjectId, "subjectId");
        Address owner = owners.get(subjectId.value());
        if (owner == null) {
            throw new RegistryException("Unknown subject: " + subjectId.value());
        }
        return owner;
    }

    /**
     * Moves a subject to {@code to}. The caller must be the owner or one of its
     * operators. Approvals granted by the previous owner stop applying.
     */
    public synchronized void transfer(Address caller, Address to, SubjectId subjectId) {
        Objects.requireNonNull(caller, "caller");
        requireOwner(to);
        Address owner = ownerOf(subjectId);
        if (!caller.equals(owner) && !isOperator(owner, caller)) {
            throw new RegistryException("Caller " + caller.value() + " may not transfer " + subjectId.value());
        }
        owners.put(subjectId.value(), to);
    }

    /**
     * Grants or revokes reusable operator standing for all subjects of {@code caller}.
     */
    public void setOperator(Address caller, Address operator, boolean approved) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(operator, "operator");
        OperatorGrant grant = new OperatorGrant(caller, operator);
        if (approved) {
            operators.add(grant);
        } else {
            operators.remove(grant);
        }
    }

    @Override
    public boolean isOperator(Address owner, Address actor) {
        return operators.contains(new OperatorGrant(owner, actor));
    }

    /**
     * Grants {@code actor} a one-time approval for {@code subjectId}. Only the
     * current owner may approve.
     */
    public void approve(Address caller, Address actor, SubjectId subjectId) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(actor, "actor");
        Address owner = ownerOf(subjectId);
        if (!caller.equals(owner)) {
            throw new RegistryException("Only the owner may approve " + subjectId.value());
        }
        approvals.put(new Approval(owner, actor, subjectId.value()), BigInteger.ONE);
    }

    @Override
    public BigInteger allowance(Address owner, Address actor, SubjectId subjectId) {
        return approvals.getOrDefault(new Approval(owner, actor, subjectId.value()), BigInteger.ZERO);
    }

    @Override
    public boolean consumeApproval(Address owner, Address actor, SubjectId subjectId) {
        BigInteger previous = approvals.remove(new Approval(owner, actor, subjectId.value()));
        return previous != null && previous.signum() != 0;
    }

    /** Number of registered subjects. */
    public int size() {
        return owners.size();
    }

    private static void requireOwner(Address owner) {
        Objects.requireNonNull(owner, "owner");
        if (owner.isZero()) {
            throw new RegistryException("Owner must not be the zero address");
        }
    }
}
