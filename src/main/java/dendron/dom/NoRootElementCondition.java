// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.dom;

import dendron.util.condition.Condition;

/**
 * A condition type indicating that the tokenizer reported no error, yet no root element was built, for example
 * because the input was empty.
 */
public final class NoRootElementCondition extends Condition {
    NoRootElementCondition() {
        super("The input contains no element");
    }
}
