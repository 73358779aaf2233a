// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.cli;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import dendron.dom.DebugRenderer;
import dendron.dom.DocumentParser;
import dendron.util.condition.ConditionContext;
import dendron.util.condition.Handler;

/**
 * Command-line front end: {@code dendron <file> [path]}.
 * <p>
 * Parses the file and prints the debug dump of its root element or, if a path is given, of every element the path
 * matches from the root.
 */
public final class Main {
    private Main() {
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    public static void main(final String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the tool with the given arguments and output streams, returning the process exit code.
     */
    public static int run(final String[] args, final PrintStream out, final PrintStream err) {
        if (args.length < 1 || args.length > 2) {
            err.println("Usage: dendron <file> [path]");
            return ExitCode.USAGE.value;
        }
        final var file = Path.of(args[0]);

        try (final var handler = new Handler(new FallbackHandler(err))) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                final var root = DocumentParser.parseFile(file);
                final var matches = (args.length == 2) ? root.elementsAtPath(args[1]) : List.of(root);
                if (matches.isEmpty()) {
                    err.println("No element matches path " + args[1]);
                    return ExitCode.NO_MATCH;
                }
                for (final var element : matches) {
                    out.print(DebugRenderer.render(element));
                }
                return ExitCode.SUCCESS;
            });
            return ((exitCode != null) ? exitCode : ExitCode.ERROR).value;
        }
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        NO_MATCH(2),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
