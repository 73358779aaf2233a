// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system, used for error reporting throughout the library.
 */
@NonNullByDefault
package dendron.util.condition;

import dendron.util.annotation.NonNullByDefault;
