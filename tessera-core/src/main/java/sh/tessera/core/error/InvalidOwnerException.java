// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when the null address is supplied as a new owner.
 *
 * <p>Giving up ownership goes through {@code renounceOwnership}, never through
 * a transfer to the zero address.
 *
 * @since 0.1.0
 */
public final class InvalidOwnerException extends CredentialException {

    public InvalidOwnerException() {
        super(ErrorKind.INVALID_OWNER, "Owner must not be the zero address");
    }
}
