package com.ryuqq.synphot.testkit.contract;

import com.ryuqq.synphot.core.spi.ReferenceSpectrum;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.DoubleUnaryOperator;

/**
 * In-memory implementation of ReferenceSpectrum for testing purposes.
 *
 * <p>The reference flux is given as an analytic function of wavelength and
 * evaluated at each grid point, so no interpolation is involved. Every
 * requested grid is recorded for later verification.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Flat or function-backed reference flux (photlam)</li>
 *   <li>Call recording ({@link #requestedGrids()}, {@link #callCount()})</li>
 *   <li>Thread-safe: grids are recorded in a copy-on-write list</li>
 * </ul>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public class InMemoryReferenceSpectrum implements ReferenceSpectrum {

    private final DoubleUnaryOperator fluxAtWave;
    private final List<double[]> requestedGrids = new CopyOnWriteArrayList<>();

    /**
     * Creates a reference spectrum backed by the given function.
     *
     * @param fluxAtWave photlam value as a function of wavelength (angstrom)
     * @throws IllegalArgumentException if fluxAtWave is null
     */
    public InMemoryReferenceSpectrum(DoubleUnaryOperator fluxAtWave) {
        if (fluxAtWave == null) {
            throw new IllegalArgumentException("fluxAtWave cannot be null");
        }
        this.fluxAtWave = fluxAtWave;
    }

    /**
     * Creates a reference spectrum with the same flux at every wavelength.
     *
     * @param photlam constant flux value
     * @return a new flat reference spectrum
     */
    public static InMemoryReferenceSpectrum flat(double photlam) {
        return new InMemoryReferenceSpectrum(wave -> photlam);
    }

    @Override
    public double[] resample(double[] waveGrid) {
        requestedGrids.add(waveGrid.clone());
        double[] flux = new double[waveGrid.length];
        for (int i = 0; i < waveGrid.length; i++) {
            flux[i] = fluxAtWave.applyAsDouble(waveGrid[i]);
        }
        return flux;
    }

    /**
     * Returns the reference flux at a single wavelength.
     *
     * @param wave wavelength in angstrom
     * @return photlam value
     */
    public double fluxAt(double wave) {
        return fluxAtWave.applyAsDouble(wave);
    }

    /**
     * Returns copies of every grid passed to {@link #resample(double[])}.
     *
     * @return requested grids in call order
     */
    public List<double[]> requestedGrids() {
        return List.copyOf(requestedGrids);
    }

    public int callCount() {
        return requestedGrids.size();
    }

    /**
     * Clears recorded calls.
     */
    public void clear() {
        requestedGrids.clear();
    }
}
