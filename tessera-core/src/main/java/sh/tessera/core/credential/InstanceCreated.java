// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import sh.tessera.core.types.Address;

/**
 * A factory created and initialized a new credential instance.
 *
 * @param source   the factory
 * @param instance the new instance address
 * @param registry the registry the instance was initialized with, after default substitution
 * @param name     the display name (empty when none was given)
 * @param creator  the caller that requested the instance and now owns it
 */
public record InstanceCreated(Address source, Address instance, Address registry, String name, Address creator)
        implements CredentialEvent {}
