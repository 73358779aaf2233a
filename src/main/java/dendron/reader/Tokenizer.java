// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.reader;

import dendron.util.annotation.Nullable;
import dendron.util.condition.Condition;

/**
 * A markup tokenizer: scans raw bytes and reports elements to an {@link ElementHandler}.
 * <p>
 * Tokenizers invoke the handler synchronously, on the calling thread, in document order. Errors are not thrown, they
 * are recorded and made available through {@link #error()} once {@link #tokenize(byte[], ElementHandler)} returns.
 */
public interface Tokenizer {
    /**
     * Scans the whole input, reporting elements to the handler, and returns once the input is exhausted or a
     * low-level error stopped the scan.
     */
    void tokenize(byte[] input, ElementHandler handler);

    /**
     * Returns the error that stopped the last {@link #tokenize(byte[], ElementHandler)} call, or {@code null} if the
     * input was scanned completely.
     */
    @Nullable Condition error();
}
