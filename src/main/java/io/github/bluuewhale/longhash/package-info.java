/**
 * Hash containers keyed by {@code long}: separate-chaining maps and linear-probing sets.
 */
@NullMarked
package io.github.bluuewhale.longhash;

import org.jspecify.annotations.NullMarked;
