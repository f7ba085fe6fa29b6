// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Validation for fixed-width {@code 0x}-prefixed hex values.
 *
 * <p>Shared by {@link Address}, {@link Hash} and the 4-byte interface identifiers,
 * which all accept mixed case on input and store lowercase.
 *
 * @since 0.1.0
 */
public final class HexValidator {

    private static final Map<Integer, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private HexValidator() {}

    /**
     * Returns the pattern for {@code 0x}-prefixed hex of exactly {@code byteLength} bytes.
     *
     * @param byteLength the number of bytes
     * @return a compiled pattern, cached per length
     */
    public static Pattern fixedLength(int byteLength) {
        if (byteLength <= 0) {
            throw new IllegalArgumentException("byteLength must be positive: " + byteLength);
        }
        return PATTERNS.computeIfAbsent(byteLength,
                n -> Pattern.compile("^0x[0-9a-fA-F]{" + (n * 2) + "}$"));
    }

    /**
     * Checks {@code value} against {@code pattern} and lowercases it.
     *
     * @param value   the candidate hex string
     * @param pattern a pattern from {@link #fixedLength(int)}
     * @param label   what the value is, used in error messages
     * @return the lowercase value
     * @throws NullPointerException     if value is null
     * @throws IllegalArgumentException if value does not match
     */
    public static String normalize(String value, Pattern pattern, String label) {
        Objects.requireNonNull(value, label);
        if (!pattern.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + label + ": " + value);
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
