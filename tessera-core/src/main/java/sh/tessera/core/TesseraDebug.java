// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

/**
 * Global toggle for verbose debug logging across Tessera modules.
 *
 * <p>Two channels exist: storage writes and authorization decisions.
 *
 * <p>Thread safety: the flags are volatile and independent of each other.
 */
public final class TesseraDebug {

    private static volatile boolean storeLogging = false;
    private static volatile boolean authLogging = false;

    private TesseraDebug() {
    }

    /** Turns both channels on or off. */
    public static void setEnabled(final boolean enabled) {
        storeLogging = enabled;
        authLogging = enabled;
    }

    public static void setStoreLogging(final boolean enabled) {
        storeLogging = enabled;
    }

    public static boolean isStoreLoggingEnabled() {
        return storeLogging;
    }

    public static void setAuthLogging(final boolean enabled) {
        authLogging = enabled;
    }

    public static boolean isAuthLoggingEnabled() {
        return authLogging;
    }
}
