package com.ryuqq.synphot.core.exception;

/**
 * 기준 단위의 변환 테이블에 대상 단위가 없을 때 발생.
 *
 * <p>고정된 단위 집합에서는 레지스트리 구성 오류를 의미합니다.
 * 범주가 다른 단위 간 변환을 요청한 경우에도 발생합니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public class UnsupportedConversionTargetException extends UnitConversionException {

    private final String target;

    public UnsupportedConversionTargetException(String target) {
        super("Target units " + target + " unrecognized");
        this.target = target;
    }

    public UnsupportedConversionTargetException(String target, String detail) {
        super("Target units " + target + " unrecognized: " + detail);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
