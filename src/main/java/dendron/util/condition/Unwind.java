// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Throwable type used by the restart mechanism to transfer control flow to a restart point.
 * <p>
 * Exposed so that methods can be declared as throwing {@code Unwind}. Catching or throwing it manually is strongly
 * discouraged.
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}, so that ordinary catch clauses don't intercept it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    // Unwinds are never serialized.
    private final transient @NotNull Restart target;
}
