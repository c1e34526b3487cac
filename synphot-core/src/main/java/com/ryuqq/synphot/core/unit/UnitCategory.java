package com.ryuqq.synphot.core.unit;

/**
 * 단위 범주.
 *
 * <p>모든 단위는 정확히 하나의 범주에 속하며, 범주 간 변환은 존재하지 않습니다.</p>
 *
 * <ul>
 *   <li>WAVE → 기준 단위 angstrom</li>
 *   <li>FLUX → 기준 단위 photlam</li>
 * </ul>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public enum UnitCategory {

    /**
     * 파장 (또는 주파수).
     */
    WAVE,

    /**
     * 분광 플럭스 밀도 (선형 및 등급).
     */
    FLUX;

    /**
     * 범주의 기준(canonical) 단위 조회.
     *
     * @return WAVE → {@link WaveUnit#ANGSTROM}, FLUX → {@link FluxUnit#PHOTLAM}
     */
    public UnitVariant canonical() {
        return switch (this) {
            case WAVE -> WaveUnit.ANGSTROM;
            case FLUX -> FluxUnit.PHOTLAM;
        };
    }
}
