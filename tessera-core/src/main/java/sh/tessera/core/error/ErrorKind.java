// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Stable identifiers for rejected credential operations.
 *
 * <p>Callers branch on the kind (or the matching exception type), never on
 * the message text.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
    /** The caller has no standing for the subject, or is not the instance owner. */
    NOT_AUTHORIZED,
    /** The subject id does not resolve in the bound registry. */
    AGENT_NOT_FOUND,
    /** The reviewer id of a review does not resolve in the bound registry. */
    REVIEWER_NOT_AGENT,
    /** The null address was supplied where a registry is required. */
    INVALID_REGISTRY,
    /** The null address was supplied as a new owner. */
    INVALID_OWNER,
    /** The instance is already initialized, or is the non-initializable template. */
    ALREADY_INITIALIZED,
    /** The deployment target address already holds something. */
    ADDRESS_OCCUPIED
}
