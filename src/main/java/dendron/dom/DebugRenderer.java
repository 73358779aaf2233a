// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.dom;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Objects;
import dendron.util.annotation.Nullable;

/**
 * A human-readable dump of element trees, for diagnostics only.
 * <p>
 * Each element is written on its own line, indented by its depth, as {@code <name {attributes}>text</name>}, followed
 * by its children. The output is <em>not</em> markup: it can't be parsed back, and its format may change at any time.
 */
public final class DebugRenderer {
    private DebugRenderer(final Appendable output) {
        this.output = output;
    }

    /**
     * Writes the dump of the tree rooted at {@code root} to the given output.
     * <p>
     * Any {@link IOException}s thrown by the output are allowed to propagate.
     */
    public static void render(final Appendable output, final Element root) throws IOException {
        new DebugRenderer(output).renderTree(root);
    }

    /**
     * Returns the dump of the tree rooted at {@code root} as a string.
     */
    public static String render(final Element root) {
        final var builder = new StringBuilder();
        try {
            render(builder, root);
        } catch (final IOException e) {
            // StringBuilder doesn't throw.
            throw new UncheckedIOException(e);
        }
        return builder.toString();
    }

    private void renderTree(final Element root) throws IOException {
        // Explicit stack, trees can be nested deeper than the call stack allows.
        final var pending = new ArrayDeque<Entry>();
        pending.push(new Entry(root, 0));
        while (!pending.isEmpty()) {
            final var entry = pending.pop();
            renderLine(entry.element(), entry.depth());
            final var children = entry.element().children();
            if (children != null) {
                for (int i = children.size() - 1; i >= 0; i -= 1) {
                    pending.push(new Entry(children.get(i), entry.depth() + 1));
                }
            }
        }
    }

    private void renderLine(final Element element, final int depth) throws IOException {
        for (int i = 0; i < depth; i += 1) {
            output.append(indentation);
        }
        output.append('<').append(element.name());
        final var attributes = element.attributes();
        if (attributes != null) {
            output.append(' ');
            renderEscaped(attributes.toString());
        }
        output.append('>');
        final var text = element.text();
        if (text != null) {
            renderEscaped(text);
        }
        output.append("</").append(element.name()).append(">\n");
    }

    private void renderEscaped(final String string) throws IOException {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index)) >= 0) {
            output.append(string, index, indexToEscape);
            output.append(Objects.requireNonNull(escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
        }
        output.append(string, index, string.length());
    }

    private static int findCharacterToEscape(final String string, final int startIndex) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    // Keeps every element on a single line.
    private static @Nullable String escape(final char character) {
        return switch (character) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            default -> null;
        };
    }

    private static final String indentation = "  ";

    private final Appendable output;

    private record Entry(Element element, int depth) {
    }
}
