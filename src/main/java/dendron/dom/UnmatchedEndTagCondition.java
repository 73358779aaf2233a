// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.dom;

import dendron.util.annotation.Nullable;
import dendron.util.condition.Condition;

/**
 * A non-fatal condition type indicating that an end event didn't match the element under construction.
 * <p>
 * Signaled by {@link TreeBuilder} when an end event arrives with no element open, or with a name different from the
 * open element's. If no handler unwinds, the builder carries on: a stray end event is ignored, a misnamed one closes
 * the open element anyway.
 */
public final class UnmatchedEndTagCondition extends Condition {
    UnmatchedEndTagCondition(final String endName, final @Nullable String openName) {
        super((openName == null)
            ? ("End of element " + endName + " found, but no element is open")
            : ("End of element " + endName + " found, but the open element is " + openName));
        this.endName = endName;
        this.openName = openName;
    }

    /**
     * Retrieves the name carried by the offending end event.
     */
    public String endName() {
        return endName;
    }

    /**
     * Retrieves the name of the element that was open at the time, or {@code null} if there was none.
     */
    public @Nullable String openName() {
        return openName;
    }

    private final String endName;
    private final @Nullable String openName;
}
