// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.dom;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import dendron.reader.SaxTokenizer;
import dendron.reader.Tokenizer;
import dendron.util.Trace;
import dendron.util.annotation.Nullable;
import dendron.util.condition.ConditionContext;
import dendron.util.condition.Handler;
import dendron.util.condition.exception.IOExceptionCondition;

/**
 * The entry points for turning markup into element trees.
 */
public final class DocumentParser {
    private DocumentParser() {
    }

    /**
     * Parses the given markup with a default {@link SaxTokenizer}.
     *
     * @see #parse(byte[], Tokenizer)
     */
    public static Element parse(final byte[] input) {
        return parse(input, new SaxTokenizer());
    }

    /**
     * Parses the given markup with the given tokenizer and returns the root element.
     * <ul>
     * <li>If the tokenizer reports an error, that error is signaled as a fatal condition, as is.
     * <li>Otherwise, if no root element was built, a fatal {@link NoRootElementCondition} is signaled.
     * </ul>
     */
    public static Element parse(final byte[] input, final Tokenizer tokenizer) {
        try (final var trace = new Trace(() -> "Building an element tree from " + input.length + " bytes")) {
            trace.use();
            final var builder = new TreeBuilder();
            tokenizer.tokenize(input, builder);
            final var error = tokenizer.error();
            if (error != null) {
                throw ConditionContext.error(error);
            }
            final var root = builder.finish();
            if (root == null) {
                throw ConditionContext.error(new NoRootElementCondition());
            }
            return root;
        }
    }

    /**
     * Reads and parses the given file.
     * <p>
     * Failures are signaled like in {@link #parse(byte[])}; if the file can't be read, a fatal
     * {@link IOExceptionCondition} is signaled.
     */
    public static Element parseFile(final Path path) {
        try (final var trace = new Trace(() -> "Parsing file " + path)) {
            trace.use();
            final byte[] input;
            try {
                input = Files.readAllBytes(path);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            return parse(input);
        }
    }

    /**
     * Reads and parses the given file, returning {@code null} if anything goes wrong.
     * <p>
     * This is a best-effort convenience: every fatal condition, be it an I/O error or a parse error, is handled by
     * returning {@code null}, so the reason for the failure is lost. Use {@link #parseFile(Path)} when it matters.
     * Non-fatal conditions are still passed on to outer handlers.
     */
    public static @Nullable Element loadFromFile(final Path path) {
        return ConditionContext.withRestart("return-nothing", restart -> {
            try (final var handler = new Handler(condition -> {
                if (condition.isFatal()) {
                    restart.unwindTo();
                }
            })) {
                handler.use();
                return parseFile(path);
            }
        });
    }
}
