/**
 * Exception hierarchy of the unit conversion SDK.
 *
 * <p>All exceptions extend {@link com.ryuqq.synphot.core.exception.UnitConversionException},
 * an unchecked exception, so callers can handle every conversion failure in one place.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.synphot.core.exception.UnknownUnitException} - unit name lookup miss</li>
 *   <li>{@link com.ryuqq.synphot.core.exception.UnsupportedConversionTargetException} - dispatch table miss</li>
 *   <li>{@link com.ryuqq.synphot.core.exception.MalformedInputException} - invalid sample arrays</li>
 *   <li>{@link com.ryuqq.synphot.core.exception.MissingReferenceSpectrumException} - vegamag without a reference spectrum</li>
 *   <li>{@link com.ryuqq.synphot.core.exception.NonFiniteResultException} - NaN/Infinity under the reject policy</li>
 * </ul>
 *
 * <p>Null arguments are reported with {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 1.0.0
 * @author Synphot Team
 */
package com.ryuqq.synphot.core.exception;
