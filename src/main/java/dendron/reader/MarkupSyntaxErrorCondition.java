// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.reader;

import dendron.util.annotation.Nullable;
import dendron.util.condition.Condition;

/**
 * A condition type indicating that the markup source is malformed and could not be tokenized.
 */
public final class MarkupSyntaxErrorCondition extends Condition {
    /**
     * Initializes a new syntax error with the given user-readable message and, if known, error location.
     */
    public MarkupSyntaxErrorCondition(final String rawMessage, final @Nullable SourceLocation location) {
        super(rawMessage);
        sourceLocation = location;
    }

    /**
     * Retrieves the location of the error, or {@code null} if the tokenizer didn't report one.
     */
    public @Nullable SourceLocation sourceLocation() {
        return sourceLocation;
    }

    @Override
    public String detailedMessage() {
        return (sourceLocation == null) ? message() : (message() + '\n' + sourceLocation);
    }

    private final @Nullable SourceLocation sourceLocation;
}
