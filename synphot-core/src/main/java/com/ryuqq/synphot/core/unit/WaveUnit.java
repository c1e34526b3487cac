package com.ryuqq.synphot.core.unit;

import com.ryuqq.synphot.core.constant.PhysicalConstants;

/**
 * 파장 단위.
 *
 * <p>모든 파장 단위는 자신으로 표현된 값을 기준 단위인 angstrom으로 변환할 줄 압니다.
 * angstrom에서 다른 단위로의 변환은 {@link com.ryuqq.synphot.core.dispatch.AngstromDispatch}가 담당합니다.</p>
 *
 * <p><strong>미터계 단위 (factor = unit당 Angstrom):</strong></p>
 * <ul>
 *   <li>nm = 10</li>
 *   <li>micron = 1e4</li>
 *   <li>mm = 1e7</li>
 *   <li>cm = 1e8</li>
 *   <li>m = 1e10</li>
 * </ul>
 *
 * <p>hz는 {@code C / wave}로 변환합니다. 모든 단위의 변환 시그니처는 단일 인자로 통일되어 있습니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public enum WaveUnit implements UnitVariant {

    ANGSTROM("angstrom", 1.0),
    NM("nm", 10.0),
    MICRON("micron", 1.0e4),
    MM("mm", 1.0e7),
    CM("cm", 1.0e8),
    M("m", 1.0e10),

    HZ("hz", Double.NaN) {
        @Override
        public double toAngstrom(double wave) {
            return PhysicalConstants.C / wave;
        }
    };

    private final String unitName;
    private final double factor;

    WaveUnit(String unitName, double factor) {
        this.unitName = unitName;
        this.factor = factor;
    }

    /**
     * 이 단위로 표현된 값을 angstrom으로 변환.
     *
     * @param wave 이 단위의 값
     * @return angstrom 값
     */
    public double toAngstrom(double wave) {
        return wave * factor;
    }

    /**
     * 미터계 배율 조회.
     *
     * @return unit당 Angstrom (hz는 NaN)
     */
    public double factor() {
        return factor;
    }

    /**
     * 선형 배율 단위인지 확인.
     *
     * @return hz가 아니면 true
     */
    public boolean isLinear() {
        return this != HZ;
    }

    @Override
    public String unitName() {
        return unitName;
    }

    @Override
    public UnitCategory category() {
        return UnitCategory.WAVE;
    }

    @Override
    public String toString() {
        return unitName;
    }
}
