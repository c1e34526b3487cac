package com.ryuqq.synphot.core.exception;

/**
 * 기준 스펙트럼이 필요한 변환(vegamag)을 기준 스펙트럼 없이 요청했을 때 발생.
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public class MissingReferenceSpectrumException extends UnitConversionException {

    public MissingReferenceSpectrumException(String unitName) {
        super("Reference spectrum is required for " + unitName + " but none was configured");
    }
}
