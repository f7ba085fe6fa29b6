// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.auth;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.credential.SubjectId;
import sh.tessera.core.types.Address;

/**
 * Decides whether an actor may act on behalf of a subject by consulting the
 * subject registry.
 *
 * <p>Resolution order:
 * <ol>
 * <li>Look up the subject's owner. Unknown subject, unresolvable registry or
 * a failing lookup yields {@link AuthorizationResult#NOT_FOUND}.</li>
 * <li>The owner itself is authorized.</li>
 * <li>An operator of the owner is authorized; the grant stays in place.</li>
 * <li>An actor holding a one-time approval for exactly this subject is
 * authorized, and the approval is consumed by this call through
 * {@link SubjectRegistry#consumeApproval}, in one atomic registry step.</li>
 * <li>Anyone else is {@link AuthorizationResult#FORBIDDEN}.</li>
 * </ol>
 *
 * <p>Registry failures in any step surface as {@code NOT_FOUND}; the raw
 * collaborator exception never reaches the caller.
 */
public final class AuthorizationGate {

    private static final Logger LOG = LoggerFactory.getLogger(AuthorizationGate.class);

    private final RegistryResolver resolver;

    public AuthorizationGate(RegistryResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Authorizes {@code actor} for {@code subjectId} against the registry at {@code registryAddress}.
     *
     * @param registryAddress the currently bound registry
     * @param actor           the calling address
     * @param subjectId       the subject acted upon
     * @return the decision
     */
    public AuthorizationResult authorize(Address registryAddress, Address actor, SubjectId subjectId) {
        Objects.requireNonNull(registryAddress, "registryAddress");
        Optional<SubjectRegistry> registry = resolver.resolve(registryAddress);
        if (registry.isEmpty()) {
            DebugLogger.logAuth("[AUTH] no registry at %s", registryAddress.value());
            return AuthorizationResult.NOT_FOUND;
        }
        return authorize(registry.get(), actor, subjectId);
    }

    /**
     * Authorizes {@code actor} for {@code subjectId} against {@code registry}.
     *
     * @param registry  the registry to consult
     * @param actor     the calling address
     * @param subjectId the subject acted upon
     * @return the decision
     */
    public AuthorizationResult authorize(SubjectRegistry registry, Address actor, SubjectId subjectId) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(subjectId, "subjectId");

        final AuthorizationResult result;
        try {
            result = resolve(registry, actor, subjectId);
        } catch (RuntimeException e) {
            LOG.debug("Registry lookup failed for {}, treating subject as unknown", subjectId, e);
            DebugLogger.logAuth("[AUTH] actor=%s subject=%s result=NOT_FOUND (registry error: %s)",
                    actor.value(), subjectId.value(), e.getMessage());
            return AuthorizationResult.NOT_FOUND;
        }
        DebugLogger.logAuth("[AUTH] actor=%s subject=%s result=%s", actor.value(), subjectId.value(), result);
        return result;
    }

    private static AuthorizationResult resolve(SubjectRegistry registry, Address actor, SubjectId subjectId) {
        Address owner = registry.ownerOf(subjectId);
        if (owner == null || owner.isZero()) {
            return AuthorizationResult.NOT_FOUND;
        }
        if (actor.equals(owner)) {
            return AuthorizationResult.AUTHORIZED;
        }
        if (registry.isOperator(owner, actor)) {
            return AuthorizationResult.AUTHORIZED;
        }
        if (registry.consumeApproval(owner, actor, subjectId)) {
            return AuthorizationResult.AUTHORIZED;
        }
        return AuthorizationResult.FORBIDDEN;
    }
}
