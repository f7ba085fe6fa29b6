// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import sh.tessera.core.credential.InterfaceId;
import sh.tessera.core.types.Address;

/**
 * Lifecycle, ownership and registry binding of a credential instance.
 */
public interface CredentialOperations {

    InterfaceId INTERFACE_ID = InterfaceId.ofSignatures(
            "initialize(address,address,string)",
            "setRegistry(address)",
            "registry()",
            "owner()",
            "transferOwnership(address)",
            "renounceOwnership()");

    /**
     * Initializes a factory clone. Succeeds once per instance; never on the template.
     *
     * @param registry    the registry; {@link Address#ZERO} selects the default registry
     * @param owner       the first owner
     * @param displayName stored under the name key when non-empty; may be null
     * @throws sh.tessera.core.error.AlreadyInitializedException if initialized before, or called on the template
     * @throws sh.tessera.core.error.InvalidOwnerException       if owner is the zero address
     */
    void initialize(Address registry, Address owner, String displayName);

    /**
     * Rebinds the instance to another registry. Owner only.
     *
     * @throws sh.tessera.core.error.InvalidRegistryException if newRegistry is the zero address
     * @throws sh.tessera.core.error.NotAuthorizedException   if the caller is not the owner
     */
    void setRegistry(Address caller, Address newRegistry);

    Address registry();

    Address owner();

    /**
     * @throws sh.tessera.core.error.InvalidOwnerException  if newOwner is the zero address
     * @throws sh.tessera.core.error.NotAuthorizedException if the caller is not the owner
     */
    void transferOwnership(Address caller, Address newOwner);

    /**
     * Sets the owner to {@link Address#ZERO}. No owner-only operation succeeds afterwards.
     *
     * @throws sh.tessera.core.error.NotAuthorizedException if the caller is not the owner
     */
    void renounceOwnership(Address caller);
}
