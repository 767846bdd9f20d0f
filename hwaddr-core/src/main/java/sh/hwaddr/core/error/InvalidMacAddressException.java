// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core.error;

import sh.hwaddr.core.LogSanitizer;

/**
 * Thrown when text is not a MAC address in plain, hyphen, colon, or dot notation.
 * <p>
 * The message is always {@value #MESSAGE}; it does not say which rule the input
 * broke. The rejected text is available through {@link #input()}, sanitized so it
 * is safe to log.
 *
 * @since 0.1.0
 */
public final class InvalidMacAddressException extends HwAddrException {

    /** Message carried by every instance. */
    public static final String MESSAGE = "Pass in 12 hexadecimal digits.";

    private final String input;

    public InvalidMacAddressException(final String input) {
        super(MESSAGE);
        this.input = LogSanitizer.sanitize(input);
    }

    /**
     * Returns the rejected input with control characters replaced and long values truncated.
     *
     * @return the sanitized input, or {@code "null"}
     */
    public String input() {
        return input;
    }
}
