// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

/**
 * Lifecycle of a {@link CredentialInstance}.
 */
public enum InstanceState {
    /** The shared logic body clones execute. Can never be initialized. */
    TEMPLATE,
    /** A fresh clone awaiting its single {@code initialize} call. */
    UNINITIALIZED,
    /** Owner and registry committed. Terminal. */
    INITIALIZED
}
