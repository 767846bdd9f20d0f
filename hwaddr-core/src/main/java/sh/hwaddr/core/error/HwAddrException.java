// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core.error;

/**
 * Base runtime exception for all hwaddr failures.
 *
 * <p>
 * This sealed class forms the root of the library's exception hierarchy, so
 * callers can catch every hwaddr-specific error with a single clause.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * HwAddrException
 * └── {@link InvalidMacAddressException} - input matches none of the accepted notations
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     MacAddress mac = new MacAddress(userInput);
 * } catch (InvalidMacAddressException e) {
 *     // Ask for 12 hex digits again
 * } catch (HwAddrException e) {
 *     // Catch-all for any other hwaddr error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class HwAddrException extends RuntimeException
        permits InvalidMacAddressException {

    public HwAddrException(final String message) {
        super(message);
    }

    public HwAddrException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
