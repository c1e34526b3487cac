package com.ryuqq.synphot.adapter.pivot;

import java.util.function.IntToDoubleFunction;
import java.util.stream.IntStream;

/**
 * 샘플별 공식을 배열 전체에 적용.
 *
 * <p>각 샘플의 결과는 다른 샘플에 의존하지 않으므로, 병렬 모드에서도
 * 동기화 없이 서로 다른 인덱스에 기록합니다. 순차/병렬 결과는 동일합니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
final class ElementwiseEvaluator {

    // Utility class - prevent instantiation
    private ElementwiseEvaluator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 새 배열에 샘플별 결과 기록.
     *
     * @param length 샘플 수
     * @param sample 인덱스 → 결과 값
     * @param parallel 병렬 평가 여부
     * @return 길이 length의 새 배열
     */
    static double[] evaluate(int length, IntToDoubleFunction sample, boolean parallel) {
        double[] result = new double[length];
        if (parallel) {
            IntStream.range(0, length).parallel().forEach(i -> result[i] = sample.applyAsDouble(i));
        } else {
            for (int i = 0; i < length; i++) {
                result[i] = sample.applyAsDouble(i);
            }
        }
        return result;
    }

    /**
     * 첫 번째 비유한 값의 인덱스.
     *
     * @param values 검사할 배열
     * @return 인덱스, 없으면 -1
     */
    static int firstNonFinite(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                return i;
            }
        }
        return -1;
    }
}
