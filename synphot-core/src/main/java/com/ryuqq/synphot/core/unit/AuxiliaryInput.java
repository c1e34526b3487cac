package com.ryuqq.synphot.core.unit;

/**
 * 플럭스 변환이 샘플별로 추가로 요구하는 입력.
 *
 * <p>변환기는 변환 1회당 보조 배열을 한 번만 계산하여 각 샘플 공식에 전달합니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public enum AuxiliaryInput {

    /**
     * 보조 입력 없음.
     */
    NONE,

    /**
     * 샘플별 파장 구간 폭 (delta-wavelength). obmag, counts.
     */
    BIN_WIDTH,

    /**
     * 파장 격자에 리샘플된 기준성 플럭스 (photlam). vegamag.
     */
    REFERENCE_FLUX
}
