// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core;

/**
 * Global toggle for enabling verbose debug logging.
 * <p>
 * Starts enabled when the {@value #PROPERTY} system property is {@code true}.
 */
public final class HwAddrDebug {

    /** System property read once at class initialization. */
    public static final String PROPERTY = "hwaddr.debug";

    private static volatile boolean enabled = Boolean.getBoolean(PROPERTY);

    private HwAddrDebug() {
    }

    public static boolean isEnabled() {
        return enabled;
    }

    public static void setEnabled(final boolean value) {
        enabled = value;
    }
}
