// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Base runtime exception for all Tessera failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * TesseraException
 * ├── {@link CredentialException} - rejected credential operations, one subclass per {@link ErrorKind}
 * │   ├── {@link NotAuthorizedException}
 * │   ├── {@link AgentNotFoundException}
 * │   ├── {@link ReviewerNotAgentException}
 * │   ├── {@link InvalidRegistryException}
 * │   ├── {@link InvalidOwnerException}
 * │   ├── {@link AlreadyInitializedException}
 * │   └── {@link AddressOccupiedException}
 * └── {@link RegistryException} - failures raised by a subject registry
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     instance.setSubjectMetadata(caller, subject, "role", value);
 * } catch (AgentNotFoundException e) {
 *     // subject does not resolve in the bound registry
 * } catch (NotAuthorizedException e) {
 *     // caller has no standing for the subject
 * } catch (TesseraException e) {
 *     // anything else
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class TesseraException extends RuntimeException
        permits CredentialException,
        RegistryException {

    public TesseraException(final String message) {
        super(message);
    }

    public TesseraException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
