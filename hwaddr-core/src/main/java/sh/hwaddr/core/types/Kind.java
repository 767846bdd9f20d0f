// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core.types;

/**
 * Extended identifier kind, read from the low bits of the first octet.
 *
 * @since 0.1.0
 */
public enum Kind {
    /** Extended unique identifier (EUI), carries an OUI. */
    UNIQUE("unique"),
    /** Extended local identifier (ELI), carries a CID. */
    LOCAL("local"),
    UNKNOWN("unknown");

    private final String label;

    Kind(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
