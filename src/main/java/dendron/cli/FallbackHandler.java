// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.cli;

import java.io.PrintStream;
import dendron.util.Trace;
import dendron.util.condition.Condition;
import dendron.util.condition.ConditionContext;
import dendron.util.condition.HandlerProcedure;
import dendron.util.condition.SignaledCondition;

/**
 * The outermost condition handler of the command-line tool.
 * <p>
 * Non-fatal conditions are reported as warnings. Fatal conditions are reported with their detailed message and the
 * operation trace, then the newest restart is invoked.
 */
final class FallbackHandler implements HandlerProcedure {
    FallbackHandler(final PrintStream err) {
        this.err = err;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            err.println("Warning: " + condition.condition().message());
            return;
        }
        showCondition(condition.condition());
        final var restarts = ConditionContext.restarts().iterator();
        if (!restarts.hasNext()) {
            throw new IllegalStateException("No restarts available");
        }
        final var restart = restarts.next();
        err.println("Unwinding to restart " + restart.name() + ".");
        restart.unwindTo();
    }

    private void showCondition(final Condition condition) {
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private final PrintStream err;
}
