/**
 * Public conversion API.
 *
 * <p>{@link com.ryuqq.synphot.application.converter.UnitConverter} is the entry point
 * consumed by spectrum-manipulation code. Implementations live in adapter modules.</p>
 *
 * @since 1.0.0
 * @author Synphot Team
 */
package com.ryuqq.synphot.application.converter;
