// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Turning raw markup bytes into ordered element start and end events.
 */
@NonNullByDefault
package dendron.reader;

import dendron.util.annotation.NonNullByDefault;
