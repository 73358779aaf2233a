// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.reader;

/**
 * A position within the markup source, both numbers starting at 1.
 */
public record SourceLocation(int lineNumber, int columnNumber) {
    @Override
    public String toString() {
        return "In line " + lineNumber + ", column " + columnNumber;
    }
}
