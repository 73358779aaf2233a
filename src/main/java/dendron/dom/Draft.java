// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.dom;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import dendron.util.annotation.Nullable;

/**
 * An element under construction: the mutable counterpart of {@link Element}, used only by {@link TreeBuilder}.
 * <p>
 * Only finished elements are ever added as children, so a draft's children are immutable even though its child list
 * isn't.
 */
final class Draft {
    Draft(final String name, final Map<String, String> attributes, final @Nullable Draft parent) {
        this.name = name;
        this.attributes = attributes;
        this.parent = parent;
    }

    String name() {
        return name;
    }

    @Nullable Draft parent() {
        return parent;
    }

    void append(final Element child) {
        children.add(child);
    }

    /**
     * Turns this draft into an element with the given text. The draft must not be used afterwards.
     */
    Element finish(final @Nullable String text) {
        return Element.classify(name, text, attributes, children);
    }

    private final String name;
    private final Map<String, String> attributes;
    private final @Nullable Draft parent;
    private final List<Element> children = new ArrayList<>();
}
