// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when the null address is supplied where a registry is required.
 *
 * @since 0.1.0
 */
public final class InvalidRegistryException extends CredentialException {

    public InvalidRegistryException() {
        super(ErrorKind.INVALID_REGISTRY, "Registry address must not be the zero address");
    }
}
