// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.auth;

/**
 * Outcome of {@link AuthorizationGate#authorize}.
 */
public enum AuthorizationResult {
    /** The actor may act for the subject. */
    AUTHORIZED,
    /** The subject does not resolve in the registry, or the registry failed. */
    NOT_FOUND,
    /** The subject exists but the actor has no standing for it. */
    FORBIDDEN
}
