// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown by a subject registry when a lookup cannot be answered, most often
 * because the subject id was never registered.
 *
 * <p>Credential instances never surface this type: the authorization gate
 * reports any registry failure as a missing subject.
 *
 * @since 0.1.0
 */
public final class RegistryException extends TesseraException {

    public RegistryException(final String message) {
        super(message);
    }

    public RegistryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
