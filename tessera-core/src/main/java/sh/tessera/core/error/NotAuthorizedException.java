// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

import sh.tessera.core.types.Address;

/**
 * Thrown when the caller lacks standing for an operation.
 *
 * <p>Raised both when the registry denies the caller for a subject and when a
 * non-owner invokes an owner-only operation.
 *
 * @since 0.1.0
 */
public final class NotAuthorizedException extends CredentialException {

    private final Address caller;

    public NotAuthorizedException(final Address caller, final String message) {
        super(ErrorKind.NOT_AUTHORIZED, message);
        this.caller = caller;
    }

    /**
     * Returns the rejected caller.
     *
     * @return the caller address
     */
    public Address caller() {
        return caller;
    }
}
