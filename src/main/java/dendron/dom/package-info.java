// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Immutable element trees: their representation, construction from element events, and path queries.
 */
@NonNullByDefault
package dendron.dom;

import dendron.util.annotation.NonNullByDefault;
