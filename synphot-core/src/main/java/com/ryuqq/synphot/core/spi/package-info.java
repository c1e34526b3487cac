/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborator the core needs but never implements.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synphot.core.spi.ReferenceSpectrum} - reference star flux resampled onto a wavelength grid</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Spectrum libraries (file loaders, resamplers) provide concrete implementations and
 * inject them into the converter. The testkit ships an in-memory implementation for tests.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Dependency Inversion:</strong> the core does not depend on spectrum loading</li>
 *   <li><strong>No import cycle:</strong> the reference spectrum is passed in, never looked up</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Synphot Team
 */
package com.ryuqq.synphot.core.spi;
