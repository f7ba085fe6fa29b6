// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import sh.tessera.core.types.Address;

/**
 * Well-known addresses.
 */
public final class TesseraAddresses {

    /**
     * Registry substituted whenever {@link Address#ZERO} is supplied in place of
     * an explicit registry at construction or initialization time.
     * <p>
     * The shared mainnet identity-registry deployment address.
     */
    public static final Address DEFAULT_REGISTRY =
        new Address("0x8004a169fb4a3325136eb29fa0ceb6d2e539a432");

    private TesseraAddresses() {}
}
