// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.dom;

import java.util.ArrayDeque;
import java.util.Map;
import dendron.reader.ElementHandler;
import dendron.util.annotation.Nullable;
import dendron.util.condition.ConditionContext;

/**
 * Builds an element tree out of start and end events.
 * <p>
 * Every element starts out as a mutable draft when its start event arrives and is turned into an immutable
 * {@link Element} when its end event arrives, at which point it's appended to its parent's children. Elements are
 * therefore finished bottom-up, the root last.
 * <p>
 * The events are expected to be properly nested, as any {@link dendron.reader.Tokenizer} guarantees. The only
 * inconsistency detected is an end event that doesn't match the open element, reported as a non-fatal
 * {@link UnmatchedEndTagCondition}.
 * <p>
 * Builders are single-use and not thread-safe.
 */
public final class TreeBuilder implements ElementHandler {
    /**
     * Opens a new element. The first element ever opened becomes the root.
     *
     * @throws IllegalArgumentException if {@code name} is empty
     */
    @Override
    public void startElement(final String name, final Map<String, String> attributes) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Element names cannot be empty");
        }
        if (rootDraft == null) {
            final var draft = new Draft(name, attributes, null);
            rootDraft = draft;
            current = draft;
        } else {
            final var parent = current;
            if (parent != null) {
                ancestors.push(parent);
            }
            current = new Draft(name, attributes, parent);
        }
    }

    /**
     * Finishes the open element, giving it the given text.
     * <p>
     * If no element is open, a non-fatal {@link UnmatchedEndTagCondition} is signaled and the event is otherwise
     * ignored. If the open element has a different name, the condition is signaled too, but the element is finished
     * anyway.
     */
    @Override
    public void endElement(final String name, final @Nullable String text) {
        final var draft = current;
        if (draft == null) {
            ConditionContext.signal(new UnmatchedEndTagCondition(name, null));
            return;
        }
        if (!name.equals(draft.name())) {
            ConditionContext.signal(new UnmatchedEndTagCondition(name, draft.name()));
        }

        final var element = draft.finish(text);
        final var parent = draft.parent();
        if (parent != null) {
            parent.append(element);
        } else if (draft == rootDraft) {
            root = element;
        }

        current = parent;
        if (!ancestors.isEmpty() && parent != null) {
            final var popped = ancestors.pop();
            assert popped == parent : "Ancestor stack out of sync with the open element's parent";
        }
    }

    /**
     * Returns the root element, or {@code null} if no root element has been finished.
     * <p>
     * Meant to be called once the event source is exhausted: while the root is still open, there's no tree to return.
     */
    public @Nullable Element finish() {
        return root;
    }

    private @Nullable Draft rootDraft = null;
    private @Nullable Element root = null;
    private @Nullable Draft current = null;
    private final ArrayDeque<Draft> ancestors = new ArrayDeque<>();
}
