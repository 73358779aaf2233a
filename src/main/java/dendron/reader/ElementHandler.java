// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.reader;

import java.util.Map;

/**
 * The receiving end of a {@link Tokenizer}.
 * <p>
 * For every element of the source, {@link #startElement(String, Map)} is called exactly once before any events of its
 * descendants, and {@link #endElement(String, String)} exactly once after all of them.
 */
public interface ElementHandler {
    /**
     * Called when the start tag of an element named {@code name} is found. Element names are never empty.
     */
    void startElement(String name, Map<String, String> attributes);

    /**
     * Called when an element ends. {@code text} is the direct text content accumulated since its start, not
     * including the text of its descendants.
     */
    void endElement(String name, String text);
}
