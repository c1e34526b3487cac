/**
 * Unit variants and the name factory.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synphot.core.unit.WaveUnit} - angstrom, nm, micron, mm, cm, m, hz</li>
 *   <li>{@link com.ryuqq.synphot.core.unit.FluxUnit} - flam, fnu, photlam, photnu, jy, mjy,
 *       abmag, stmag, obmag, vegamag, counts</li>
 * </ul>
 *
 * <h2>Name Resolution</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synphot.core.unit.UnitAliases} - case-insensitive spelling to canonical name</li>
 *   <li>{@link com.ryuqq.synphot.core.unit.Units} - canonical name to variant</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Closed set:</strong> variants are enum constants behind a sealed interface</li>
 *   <li><strong>Stateless:</strong> the only per-variant data is a fixed scale factor or auxiliary input kind</li>
 *   <li><strong>Pivot only:</strong> each variant knows its conversion to the canonical unit, nothing else</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synphot Team
 */
package com.ryuqq.synphot.core.unit;
