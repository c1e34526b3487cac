package com.ryuqq.synphot.core.unit;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 입력 철자 → 기준 단위 이름 매핑.
 *
 * <p>키는 소문자로 저장되며, 조회 시 입력을 trim 후 {@link Locale#ROOT} 기준으로 소문자화합니다.
 * 모든 기준 이름은 자기 자신으로 매핑됩니다.</p>
 *
 * <p><strong>별칭:</strong></p>
 * <ul>
 *   <li>angstroms → angstrom</li>
 *   <li>um → micron</li>
 *   <li>meter → m</li>
 * </ul>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public final class UnitAliases {

    private static final Map<String, String> ALIASES;

    static {
        Map<String, String> aliases = new HashMap<>();
        for (WaveUnit unit : WaveUnit.values()) {
            aliases.put(unit.unitName(), unit.unitName());
        }
        for (FluxUnit unit : FluxUnit.values()) {
            aliases.put(unit.unitName(), unit.unitName());
        }
        aliases.put("angstroms", WaveUnit.ANGSTROM.unitName());
        aliases.put("um", WaveUnit.MICRON.unitName());
        aliases.put("meter", WaveUnit.M.unitName());
        ALIASES = Map.copyOf(aliases);
    }

    // Utility class - prevent instantiation
    private UnitAliases() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 입력 철자를 기준 이름으로 정규화.
     *
     * @param name 입력 단위 이름 (대소문자 무관)
     * @return 기준 이름, 매핑이 없으면 null
     */
    public static String canonicalName(String name) {
        if (name == null) {
            return null;
        }
        return ALIASES.get(name.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 전체 매핑 조회.
     *
     * @return 불변 Map (소문자 철자 → 기준 이름)
     */
    public static Map<String, String> aliases() {
        return ALIASES;
    }
}
