// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when {@code initialize} is called on an instance that is already
 * initialized, or on the template, which can never be initialized.
 *
 * @since 0.1.0
 */
public final class AlreadyInitializedException extends CredentialException {

    public AlreadyInitializedException(final String message) {
        super(ErrorKind.ALREADY_INITIALIZED, message);
    }
}
