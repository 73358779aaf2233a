// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.dom;

import java.util.ArrayList;
import java.util.List;
import dendron.util.annotation.Nullable;

/**
 * A conversion from elements to objects of some other type, which may fail.
 * <p>
 * Typically implemented by a static factory of a value type, for example {@code Book::fromElement}.
 *
 * @param <T> the type of converted objects
 */
@FunctionalInterface
public interface ElementConverter<T> {
    /**
     * Converts the given element, returning {@code null} if it doesn't describe a valid object.
     */
    @Nullable T convert(Element element);

    /**
     * Converts the element found at the given path, as in {@link Element#elementAtPath(String)}. Returns {@code null}
     * if there's no such element or if it can't be converted.
     */
    default @Nullable T convertAt(final Element origin, final String path) {
        final var element = origin.elementAtPath(path);
        return (element == null) ? null : convert(element);
    }

    /**
     * Converts all elements found at the given path, as in {@link Element#elementsAtPath(String)}, in document order.
     * Elements that can't be converted are skipped.
     */
    default List<T> convertAll(final Element origin, final String path) {
        final var result = new ArrayList<T>();
        for (final var element : origin.elementsAtPath(path)) {
            final var converted = convert(element);
            if (converted != null) {
                result.add(converted);
            }
        }
        return result;
    }
}
