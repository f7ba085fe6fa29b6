// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import java.util.Arrays;
import java.util.Objects;

import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.primitives.Hex;
import sh.tessera.primitives.Words;

/**
 * Deterministic address derivation for template clones.
 *
 * <p>A clone's identity is the EIP-1167 minimal-proxy creation code with the
 * template address embedded. Its deterministic address follows EIP-1014:
 * {@code keccak256(0xff || deployer || salt || keccak256(initCode))[12:]}.
 * The result depends only on the deployer, the salt and the template, so it
 * can be computed before the clone exists.
 */
public final class CloneAddresses {

    private static final byte[] PROXY_PREFIX = Hex.decode("0x3d602d80600a3d3981f3363d3d373d3d3d363d73");
    private static final byte[] PROXY_SUFFIX = Hex.decode("0x5af43d82803e903d91602b57fd5bf3");
    private static final byte[] CREATE2_MARKER = {(byte) 0xff};

    private CloneAddresses() {}

    /**
     * Returns the minimal-proxy creation code delegating to {@code template}.
     *
     * @param template the template address
     * @return 55 bytes of creation code
     */
    public static byte[] cloneInitCode(Address template) {
        Objects.requireNonNull(template, "template");
        return Words.concat(PROXY_PREFIX, template.toBytes(), PROXY_SUFFIX);
    }

    /**
     * Returns the code identity of every clone of {@code template}.
     */
    public static Hash cloneCodeHash(Address template) {
        return Hash.fromBytes(Keccak256.hash(cloneInitCode(template)));
    }

    /**
     * Computes the EIP-1014 address for {@code deployer}, {@code salt} and creation-code hash.
     */
    public static Address create2(Address deployer, Hash salt, Hash initCodeHash) {
        Objects.requireNonNull(deployer, "deployer");
        Objects.requireNonNull(salt, "salt");
        Objects.requireNonNull(initCodeHash, "initCodeHash");
        byte[] digest = Keccak256.hash(CREATE2_MARKER, deployer.toBytes(), salt.toBytes(), initCodeHash.toBytes());
        return Address.fromBytes(Arrays.copyOfRange(digest, 12, 32));
    }

    /**
     * Computes where a clone of {@code template} created by {@code deployer} with {@code salt} will live.
     */
    public static Address predict(Address deployer, Hash salt, Address template) {
        return create2(deployer, salt, cloneCodeHash(template));
    }
}
