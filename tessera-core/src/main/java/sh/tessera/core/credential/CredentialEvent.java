// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import sh.tessera.core.types.Address;

/**
 * Notification emitted after a credential operation commits.
 *
 * <p>Events feed off-path indexers and observers. Nothing in the credential
 * logic reads them back.
 */
public sealed interface CredentialEvent
        permits MetadataChanged, ReviewSubmitted, OwnershipTransferred, RegistryUpdated, InstanceCreated {

    /**
     * Returns the address of the instance or factory that emitted the event.
     *
     * @return the emitter address
     */
    Address source();
}
