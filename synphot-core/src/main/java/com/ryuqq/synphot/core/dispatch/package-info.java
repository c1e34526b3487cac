/**
 * Canonical dispatch tables.
 *
 * <p>The canonical unit of each category is the only unit that converts to
 * every other unit. A conversion between two arbitrary units is always
 * {@code source -> canonical} followed by a lookup in one of these tables.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.synphot.core.dispatch.AngstromDispatch} - angstrom to every wave unit</li>
 *   <li>{@link com.ryuqq.synphot.core.dispatch.PhotlamDispatch} - photlam to every flux unit</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synphot Team
 */
package com.ryuqq.synphot.core.dispatch;
