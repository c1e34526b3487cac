package com.ryuqq.synphot.core.exception;

/**
 * 샘플 배열이 변환 전제 조건을 만족하지 않을 때 발생.
 *
 * <p>예: wave/flux 길이 불일치, 엄격히 증가하지 않는 파장 격자,
 * 2개 미만 샘플에 대한 구간 폭 계산.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public class MalformedInputException extends UnitConversionException {

    public MalformedInputException(String message) {
        super(message);
    }
}
