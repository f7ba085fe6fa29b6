// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.store;

import java.util.Objects;

import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.types.Hash;

/**
 * Isolated key/value area identified by a fixed domain string.
 *
 * <p>The identifier is {@code keccak256(domain)}: a pure function of the
 * domain, independent of which instance uses it or when it was created. Every
 * instance therefore finds its own copy of a namespace at the same slots of
 * its private {@link StorageRegion}, and two namespaces with different domains
 * never share a slot.
 *
 * @param domain human-readable domain, e.g. {@code "tessera.credential.reviews.v1"}
 * @param id     {@code keccak256(domain)}
 */
public record Namespace(String domain, Hash id) {

    public Namespace {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(id, "id");
        if (domain.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank");
        }
        if (!id.equals(Keccak256.hashUtf8(domain))) {
            throw new IllegalArgumentException("id does not match domain " + domain);
        }
    }

    /**
     * Derives the namespace for a domain string.
     *
     * @param domain the domain
     * @return the namespace
     */
    public static Namespace of(String domain) {
        Objects.requireNonNull(domain, "domain");
        return new Namespace(domain, Keccak256.hashUtf8(domain));
    }
}
