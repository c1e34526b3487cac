package com.ryuqq.synphot.core.exception;

/**
 * 변환 결과에 NaN 또는 Infinity가 포함되었고, 변환기가 이를 거부하도록 설정된 경우 발생.
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public class NonFiniteResultException extends UnitConversionException {

    private final int index;

    public NonFiniteResultException(int index, double value, String route) {
        super(String.format("Non-finite result %s at sample %d (%s)", value, index, route));
        this.index = index;
    }

    /**
     * 처음 발견된 비유한 샘플의 인덱스.
     *
     * @return 샘플 인덱스
     */
    public int getIndex() {
        return index;
    }
}
