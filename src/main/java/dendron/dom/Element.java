// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.dom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import dendron.util.UnreachableCodeReachedError;
import dendron.util.annotation.Nullable;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * A node of an element tree, corresponding to one tag pair or self-closing tag of the source document.
 * <p>
 * Elements are immutable once built. Each one is stored in the most compact of four shapes, chosen from which of its
 * text, attributes and children are present: {@link Leaf}, {@link List}, {@link Empty} or {@link General}. The shape
 * is an implementation detail as far as reading goes: {@link #text()}, {@link #attributes()} and {@link #children()}
 * work the same on all of them, and read as {@code null} whenever the corresponding part is absent, never as an empty
 * string or collection.
 * <p>
 * The parent reference is purely navigational: an element is owned by its parent's child list, and the parent link
 * only allows walking back up.
 */
public abstract sealed class Element {
    private Element(final String name) {
        assert !name.isEmpty() : "Element names cannot be empty";
        this.name = name;
    }

    /**
     * Retrieves the name of this element.
     */
    public final String name() {
        return name;
    }

    /**
     * Retrieves the element enclosing this one, or {@code null} for the root.
     */
    public final @Nullable Element parent() {
        return parent;
    }

    /**
     * Retrieves the direct text content of this element, or {@code null} if it has none.
     */
    public final @Nullable String text() {
        if (this instanceof Leaf leaf) {
            return leaf.text;
        } else if (this instanceof General general) {
            return general.text;
        } else if (this instanceof List || this instanceof Empty) {
            return null;
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    /**
     * Retrieves the attributes of this element, in source order, or {@code null} if it has none.
     * <p>
     * The returned map is unmodifiable.
     */
    public final @Nullable Map<String, String> attributes() {
        if (this instanceof Empty empty) {
            return empty.attributes;
        } else if (this instanceof General general) {
            return general.attributes;
        } else if (this instanceof Leaf || this instanceof List) {
            return null;
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    /**
     * Retrieves the child elements of this element, in document order, or {@code null} if it has none.
     * <p>
     * The returned list is unmodifiable.
     */
    public final @Nullable java.util.List<Element> children() {
        if (this instanceof List list) {
            return list.children;
        } else if (this instanceof General general) {
            return general.children;
        } else if (this instanceof Leaf || this instanceof Empty) {
            return null;
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    /**
     * Retrieves the value of the attribute with the given name, or {@code null} if no such attribute is present.
     */
    public final @Nullable String attribute(final String attributeName) {
        final var attributes = attributes();
        return (attributes == null) ? null : attributes.get(attributeName);
    }

    /**
     * Retrieves the direct child at the given index in document order, or {@code null} if the index is out of range
     * or this element has no children.
     */
    public final @Nullable Element child(final int index) {
        final var children = children();
        if (children == null || index < 0 || index >= children.size()) {
            return null;
        }
        return children.get(index);
    }

    /**
     * Resolves the given dot-separated path to a single element, or {@code null} if nothing matches.
     * <p>
     * If the first component of the path is empty or equal to this element's name, it denotes this element itself.
     * Every other component selects the <em>first</em> child, in document order, with that name.
     * <p>
     * For example, on an element {@code a}, both {@code "a.b.c"} and {@code ".b.c"} find the first {@code c} of the
     * first {@code b}, while {@code "b.c"} does the same without naming the starting element.
     */
    @CheckReturnValue
    public final @Nullable Element elementAtPath(final String path) {
        return PathResolver.elementAtPath(this, path);
    }

    /**
     * Resolves the given dot-separated path to all elements it matches, in document order.
     * <p>
     * Path components are interpreted like in {@link #elementAtPath(String)}, except that every child with
     * a matching name is followed, not just the first one. The returned list is unmodifiable, and empty if nothing
     * matches.
     */
    @CheckReturnValue
    public final java.util.List<Element> elementsAtPath(final String path) {
        return PathResolver.elementsAtPath(this, path);
    }

    /**
     * Same as {@link #elementAtPath(String)}.
     */
    @CheckReturnValue
    public final @Nullable Element get(final String path) {
        return elementAtPath(path);
    }

    /**
     * Returns a multi-line, human-readable dump of the tree rooted at this element, meant only for diagnostics.
     *
     * @see DebugRenderer
     */
    @Override
    public final String toString() {
        return DebugRenderer.render(this);
    }

    /**
     * Builds an element in the most compact shape able to hold the given parts.
     * <p>
     * Empty text, attributes or children are treated as absent.
     */
    static Element classify(
        final String name,
        final @Nullable String text,
        final @Nullable Map<String, String> attributes,
        final @Nullable java.util.List<Element> children
    ) {
        final var hasText = text != null && !text.isEmpty();
        final var hasChildren = children != null && !children.isEmpty();
        final var hasAttributes = attributes != null && !attributes.isEmpty();
        if (hasText && !hasChildren && !hasAttributes) {
            return new Leaf(name, text);
        } else if (!hasText && hasChildren && !hasAttributes) {
            return new List(name, children);
        } else if (!hasText && !hasChildren && hasAttributes) {
            return new Empty(name, attributes);
        } else {
            return new General(
                name,
                hasText ? text : null,
                hasAttributes ? attributes : null,
                hasChildren ? children : null
            );
        }
    }

    private static Map<String, String> freeze(final Map<String, String> attributes) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    private static java.util.List<Element> adopt(final Element parent, final java.util.List<Element> children) {
        final var frozen = java.util.List.copyOf(children);
        for (final var child : frozen) {
            assert child.parent == null : "Element " + child.name + " already has a parent";
            child.parent = parent;
        }
        return frozen;
    }

    private final String name;
    // Set once, when the parent is built. Children are always built before their parent.
    private @Nullable Element parent = null;

    /**
     * An element holding text only.
     */
    public static final class Leaf extends Element {
        private Leaf(final String name, final String text) {
            super(name);
            this.text = text;
        }

        private final String text;
    }

    /**
     * An element holding child elements only.
     */
    public static final class List extends Element {
        private List(final String name, final java.util.List<Element> children) {
            super(name);
            this.children = adopt(this, children);
        }

        private final java.util.List<Element> children;
    }

    /**
     * An element holding attributes only, typically a self-closing tag.
     */
    public static final class Empty extends Element {
        private Empty(final String name, final Map<String, String> attributes) {
            super(name);
            this.attributes = freeze(attributes);
        }

        private final Map<String, String> attributes;
    }

    /**
     * An element with any other combination of text, attributes and children, including none of them at all.
     */
    public static final class General extends Element {
        private General(
            final String name,
            final @Nullable String text,
            final @Nullable Map<String, String> attributes,
            final @Nullable java.util.List<Element> children
        ) {
            super(name);
            this.text = text;
            this.attributes = (attributes == null) ? null : freeze(attributes);
            this.children = (children == null) ? null : adopt(this, children);
        }

        private final @Nullable String text;
        private final @Nullable Map<String, String> attributes;
        private final @Nullable java.util.List<Element> children;
    }
}
