// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.util.condition.exception;

import javax.xml.parsers.ParserConfigurationException;
import org.jetbrains.annotations.NotNull;

/**
 * A condition type indicating that the JDK's SAX parser could not be configured as requested.
 */
public final class ParserConfigurationExceptionCondition extends ExceptionCondition<ParserConfigurationException> {
    /**
     * Initializes a new {@code ParserConfigurationExceptionCondition} representing the given
     * {@link ParserConfigurationException}.
     */
    public ParserConfigurationExceptionCondition(final @NotNull ParserConfigurationException exception) {
        super(exception);
    }
}
