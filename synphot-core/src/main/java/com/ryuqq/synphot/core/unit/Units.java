package com.ryuqq.synphot.core.unit;

import com.ryuqq.synphot.core.exception.UnknownUnitException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 단위 이름 → {@link UnitVariant} 팩토리.
 *
 * <p>입력은 대소문자를 구분하지 않으며 {@link UnitAliases}를 거쳐 조회됩니다.
 * 부수 효과가 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * UnitVariant unit = Units.resolve("Angstroms");          // WaveUnit.ANGSTROM
 * WaveUnit wave = Units.wave("um");                        // WaveUnit.MICRON
 * FluxUnit flux = Units.flux("FLAM");                      // FluxUnit.FLAM
 * Units.resolve("parsecs");                                // UnknownUnitException
 * </pre>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public final class Units {

    private static final Map<String, UnitVariant> BY_NAME;

    static {
        Map<String, UnitVariant> byName = new HashMap<>();
        for (WaveUnit unit : WaveUnit.values()) {
            byName.put(unit.unitName(), unit);
        }
        for (FluxUnit unit : FluxUnit.values()) {
            byName.put(unit.unitName(), unit);
        }
        BY_NAME = Map.copyOf(byName);
    }

    // Utility class - prevent instantiation
    private Units() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단위 이름 해석.
     *
     * @param name 단위 이름 또는 별칭 (대소문자 무관)
     * @return 단위
     * @throws UnknownUnitException 매핑이 없거나 name이 null/blank인 경우
     */
    public static UnitVariant resolve(String name) {
        String canonicalName = UnitAliases.canonicalName(name);
        UnitVariant unit = canonicalName == null ? null : BY_NAME.get(canonicalName);
        if (unit == null) {
            throw new UnknownUnitException(name);
        }
        return unit;
    }

    /**
     * 범주를 지정한 단위 이름 해석.
     *
     * @param name 단위 이름 또는 별칭
     * @param category 기대하는 범주
     * @return 단위
     * @throws IllegalArgumentException category가 null인 경우
     * @throws UnknownUnitException 매핑이 없거나 다른 범주의 단위인 경우
     */
    public static UnitVariant resolve(String name, UnitCategory category) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        UnitVariant unit = resolve(name);
        if (unit.category() != category) {
            throw new UnknownUnitException(name, "not a " + category + " unit");
        }
        return unit;
    }

    /**
     * 파장 단위 해석.
     *
     * @param name 단위 이름 또는 별칭
     * @return 파장 단위
     * @throws UnknownUnitException 파장 단위가 아닌 경우
     */
    public static WaveUnit wave(String name) {
        return (WaveUnit) resolve(name, UnitCategory.WAVE);
    }

    /**
     * 플럭스 단위 해석.
     *
     * @param name 단위 이름 또는 별칭
     * @return 플럭스 단위
     * @throws UnknownUnitException 플럭스 단위가 아닌 경우
     */
    public static FluxUnit flux(String name) {
        return (FluxUnit) resolve(name, UnitCategory.FLUX);
    }

    /**
     * 범주에 속한 기준 이름 목록 (선언 순서).
     *
     * @param category 범주
     * @return 불변 목록
     */
    public static List<String> names(UnitCategory category) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        UnitVariant[] units = category == UnitCategory.WAVE ? WaveUnit.values() : FluxUnit.values();
        List<String> names = new ArrayList<>(units.length);
        for (UnitVariant unit : units) {
            names.add(unit.unitName());
        }
        return Collections.unmodifiableList(names);
    }
}
