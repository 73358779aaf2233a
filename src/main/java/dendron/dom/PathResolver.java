// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.dom;

import java.util.ArrayList;
import java.util.List;
import dendron.util.annotation.Nullable;

/**
 * Resolution of dot-separated element paths, backing {@link Element#elementAtPath(String)} and
 * {@link Element#elementsAtPath(String)}.
 * <p>
 * A path like {@code "a.b.c"} is a sequence of literal element names. The first component is consumed without
 * matching anything if it's empty or equal to the starting element's own name; note that this means a child with the
 * same name as its parent can only be reached by spelling the parent's name first ({@code "a.a"} or {@code ".a"}).
 */
final class PathResolver {
    private PathResolver() {
    }

    static @Nullable Element elementAtPath(final Element origin, final String path) {
        final var components = split(path);
        Element match = origin;
        for (int i = firstMatchedComponent(origin, components); i < components.length; i += 1) {
            match = firstChildNamed(match, components[i]);
            if (match == null) {
                return null;
            }
        }
        return match;
    }

    static List<Element> elementsAtPath(final Element origin, final String path) {
        final var components = split(path);
        List<Element> matches = List.of(origin);
        for (int i = firstMatchedComponent(origin, components); i < components.length; i += 1) {
            final var component = components[i];
            final var next = new ArrayList<Element>();
            for (final var match : matches) {
                final var children = match.children();
                if (children == null) {
                    continue;
                }
                for (final var child : children) {
                    if (component.equals(child.name())) {
                        next.add(child);
                    }
                }
            }
            if (next.isEmpty()) {
                return List.of();
            }
            matches = next;
        }
        return List.copyOf(matches);
    }

    private static String[] split(final String path) {
        // Empty components are kept, they never match any child.
        return path.split("\\.", -1);
    }

    private static int firstMatchedComponent(final Element origin, final String[] components) {
        final var first = components[0];
        return (first.isEmpty() || first.equals(origin.name())) ? 1 : 0;
    }

    private static @Nullable Element firstChildNamed(final Element element, final String name) {
        final var children = element.children();
        if (children == null) {
            return null;
        }
        for (final var child : children) {
            if (name.equals(child.name())) {
                return child;
            }
        }
        return null;
    }
}
