// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

import java.util.Objects;

/**
 * A credential operation was rejected before changing any state.
 *
 * <p>Every subclass maps to exactly one {@link ErrorKind}. Rejections are
 * deterministic for a given state and input, so none of them is worth
 * retrying without changing one of the two.
 *
 * @since 0.1.0
 */
public abstract sealed class CredentialException extends TesseraException
        permits NotAuthorizedException,
        AgentNotFoundException,
        ReviewerNotAgentException,
        InvalidRegistryException,
        InvalidOwnerException,
        AlreadyInitializedException,
        AddressOccupiedException {

    private final ErrorKind kind;

    protected CredentialException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Returns the kind of rejection.
     *
     * @return the error kind
     */
    public ErrorKind kind() {
        return kind;
    }
}
