/**
 * Pivot converter adapter.
 *
 * <p>{@link com.ryuqq.synphot.adapter.pivot.PivotUnitConverter} implements the
 * {@code source -> canonical -> target} route over the core dispatch tables.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synphot.adapter.pivot.PivotUnitConverter} - two-hop converter</li>
 *   <li>{@link com.ryuqq.synphot.adapter.pivot.ConverterConfig} - parallel threshold and non-finite policy</li>
 *   <li>{@link com.ryuqq.synphot.adapter.pivot.NonFinitePolicy} - NaN/Infinity handling</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synphot Team
 */
package com.ryuqq.synphot.adapter.pivot;
