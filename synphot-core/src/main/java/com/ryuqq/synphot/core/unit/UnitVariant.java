package com.ryuqq.synphot.core.unit;

/**
 * 이름이 부여된 단위 하나.
 *
 * <p>UnitVariant는 두 가지 범주로 나뉩니다:</p>
 * <ul>
 *   <li>{@link WaveUnit}: 파장/주파수 단위, angstrom으로 변환 가능</li>
 *   <li>{@link FluxUnit}: 플럭스 밀도 단위, photlam으로 변환 가능</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 단위 집합이 컴파일 타임에 고정됩니다.
 * 모든 구현은 enum 상수이므로 불변이며 상태를 갖지 않습니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public sealed interface UnitVariant permits WaveUnit, FluxUnit {

    /**
     * 소문자 기준 이름 조회 (예: angstrom, photlam).
     *
     * @return 단위 이름
     */
    String unitName();

    /**
     * 단위 범주 조회.
     *
     * @return 범주
     */
    UnitCategory category();

    /**
     * 범주의 기준 단위인지 확인.
     *
     * @return angstrom 또는 photlam이면 true
     */
    default boolean isCanonical() {
        return category().canonical() == this;
    }

    /**
     * 플럭스 단위인지 확인.
     *
     * @return FLUX 범주이면 true
     */
    default boolean isFlux() {
        return category() == UnitCategory.FLUX;
    }
}
