package com.ryuqq.synphot.core.exception;

/**
 * 단위 변환 SDK의 모든 예외의 상위 타입.
 *
 * <p>모든 변환은 순수하고 결정적이므로 이 계열의 예외는 재시도 대상이 아닙니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public class UnitConversionException extends RuntimeException {

    public UnitConversionException(String message) {
        super(message);
    }

    public UnitConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
