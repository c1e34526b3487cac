/**
 * Wavelength grid helpers.
 *
 * @since 1.0.0
 * @author Synphot Team
 */
package com.ryuqq.synphot.core.grid;
