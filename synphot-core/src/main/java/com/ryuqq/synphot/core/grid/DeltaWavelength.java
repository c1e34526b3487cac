package com.ryuqq.synphot.core.grid;

import com.ryuqq.synphot.core.exception.MalformedInputException;

/**
 * 파장 샘플별 구간 폭(delta-wavelength) 추정.
 *
 * <p>광자 계수 단위(counts, obmag)가 단위 파장당 밀도와 구간당 개수를 오갈 때 사용합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delta[0]     = wave[1] - wave[0]
 * delta[i]     = (wave[i+1] - wave[i-1]) / 2     (0 &lt; i &lt; N-1)
 * delta[N-1]   = wave[N-1] - wave[N-2]
 * </pre>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public final class DeltaWavelength {

    // Utility class - prevent instantiation
    private DeltaWavelength() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 구간 폭 계산.
     *
     * <p>입력 배열은 변경하지 않으며 항상 새 배열을 반환합니다.</p>
     *
     * @param wave 정렬된 파장 배열
     * @return wave와 같은 길이의 구간 폭 배열
     * @throws MalformedInputException wave가 null이거나 길이가 2 미만인 경우
     */
    public static double[] of(double[] wave) {
        if (wave == null) {
            throw new MalformedInputException("wave cannot be null");
        }
        if (wave.length < 2) {
            throw new MalformedInputException(
                "Bin width requires at least 2 wavelength samples (current: " + wave.length + ")"
            );
        }

        int last = wave.length - 1;
        double[] delta = new double[wave.length];
        for (int i = 1; i < last; i++) {
            delta[i] = (wave[i + 1] - wave[i - 1]) / 2.0;
        }
        delta[0] = wave[1] - wave[0];
        delta[last] = wave[last] - wave[last - 1];
        return delta;
    }
}
