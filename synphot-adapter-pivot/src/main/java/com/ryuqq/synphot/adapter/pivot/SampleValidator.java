package com.ryuqq.synphot.adapter.pivot;

import com.ryuqq.synphot.core.exception.MalformedInputException;

/**
 * 변환 경계에서의 샘플 배열 검증.
 *
 * @author Synphot Team
 * @since 1.0.0
 */
final class SampleValidator {

    // Utility class - prevent instantiation
    private SampleValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static void requireSamples(double[] values, String name) {
        if (values == null) {
            throw new MalformedInputException(name + " cannot be null");
        }
        if (values.length == 0) {
            throw new MalformedInputException(name + " cannot be empty");
        }
    }

    static void requireSameLength(double[] wave, double[] flux) {
        if (wave.length != flux.length) {
            throw new MalformedInputException(
                String.format("wave and flux lengths differ (wave: %d, flux: %d)", wave.length, flux.length)
            );
        }
    }

    /**
     * 파장 격자가 엄격히 증가하는지 검증.
     *
     * <p>NaN이 포함된 격자도 거부됩니다.</p>
     */
    static void requireAscending(double[] wave) {
        for (int i = 1; i < wave.length; i++) {
            if (!(wave[i] > wave[i - 1])) {
                throw new MalformedInputException(
                    String.format("wave must be strictly increasing (index %d: %s -> %s)", i, wave[i - 1], wave[i])
                );
            }
        }
    }

    static void requireUnit(Object unit, String name) {
        if (unit == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
