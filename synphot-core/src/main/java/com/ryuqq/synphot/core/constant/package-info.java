/**
 * Physical constants shared by the conversion formulas.
 *
 * @since 1.0.0
 * @author Synphot Team
 */
package com.ryuqq.synphot.core.constant;
