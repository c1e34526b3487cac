package com.ryuqq.synphot.core.exception;

/**
 * 단위 이름을 해석할 수 없을 때 발생.
 *
 * <p>항상 호출자에게 전달되며 내부에서 복구하지 않습니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public class UnknownUnitException extends UnitConversionException {

    private final String unitName;

    public UnknownUnitException(String unitName) {
        super("Unknown units: " + unitName);
        this.unitName = unitName;
    }

    public UnknownUnitException(String unitName, String detail) {
        super("Unknown units: " + unitName + " (" + detail + ")");
        this.unitName = unitName;
    }

    /**
     * 해석에 실패한 원본 문자열 조회.
     *
     * @return 입력된 단위 이름 (null 가능)
     */
    public String getUnitName() {
        return unitName;
    }
}
