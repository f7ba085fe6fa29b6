// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.auth;

import java.math.BigInteger;

import sh.tessera.core.credential.SubjectId;
import sh.tessera.core.types.Address;

/**
 * The ownership facts a credential instance needs from a subject registry.
 *
 * <p>Implementations are external collaborators. The authorization gate
 * relies on nothing beyond these four operations, and treats any exception
 * they throw as "subject unknown".
 */
public interface SubjectRegistry {

    /**
     * Returns the current owner of a subject.
     *
     * @param subjectId the subject
     * @return the owner address
     * @throws RuntimeException if the subject is unknown
     */
    Address ownerOf(SubjectId subjectId);

    /**
     * Returns whether {@code actor} holds a standing operator grant from {@code owner}.
     * Operator grants are reusable until the owner revokes them.
     */
    boolean isOperator(Address owner, Address actor);

    /**
     * Returns the one-time approval {@code owner} granted {@code actor} for
     * {@code subjectId}. Non-zero means approved.
     */
    BigInteger allowance(Address owner, Address actor, SubjectId subjectId);

    /**
     * Atomically checks and clears a one-time approval.
     *
     * <p>If {@link #allowance} is non-zero for the triple, sets it to zero and
     * returns {@code true}; otherwise returns {@code false} and changes nothing.
     * Two callers racing on the same approval must see exactly one {@code true}.
     *
     * @return whether a live approval was consumed
     */
    boolean consumeApproval(Address owner, Address actor, SubjectId subjectId);
}
