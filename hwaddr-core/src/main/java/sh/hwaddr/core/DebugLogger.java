// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger, gated by {@link HwAddrDebug}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.hwaddr.debug");

    private DebugLogger() {
    }

    /**
     * Logs a {@link String#formatted} message when debug logging is enabled.
     */
    public static void log(final String message, final Object... args) {
        if (!HwAddrDebug.isEnabled()) {
            return;
        }
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
