package com.ryuqq.synphot.core.dispatch;

import com.ryuqq.synphot.core.constant.PhysicalConstants;
import com.ryuqq.synphot.core.exception.UnsupportedConversionTargetException;
import com.ryuqq.synphot.core.unit.WaveUnit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * 기준 파장 단위(angstrom)에서 각 파장 단위로의 변환 테이블.
 *
 * <p>각 항목은 {@link WaveUnit#toAngstrom(double)}의 정확한 역변환입니다.
 * angstrom → angstrom은 항등 변환입니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public final class AngstromDispatch {

    private static final Map<WaveUnit, DoubleUnaryOperator> TABLE;

    static {
        Map<WaveUnit, DoubleUnaryOperator> table = new EnumMap<>(WaveUnit.class);
        table.put(WaveUnit.ANGSTROM, wave -> wave);
        table.put(WaveUnit.NM, wave -> wave / 10.0);
        table.put(WaveUnit.MICRON, wave -> wave * 1.0e-4);
        table.put(WaveUnit.MM, wave -> wave * 1.0e-7);
        table.put(WaveUnit.CM, wave -> wave * 1.0e-8);
        table.put(WaveUnit.M, wave -> wave * 1.0e-10);
        table.put(WaveUnit.HZ, wave -> PhysicalConstants.C / wave);
        TABLE = Collections.unmodifiableMap(table);
    }

    // Utility class - prevent instantiation
    private AngstromDispatch() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 대상 단위의 변환 공식 조회.
     *
     * @param target 대상 파장 단위
     * @return angstrom 값을 target 값으로 바꾸는 함수
     * @throws IllegalArgumentException target이 null인 경우
     * @throws UnsupportedConversionTargetException 테이블에 없는 경우
     */
    public static DoubleUnaryOperator lookup(WaveUnit target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        DoubleUnaryOperator conversion = TABLE.get(target);
        if (conversion == null) {
            throw new UnsupportedConversionTargetException(target.unitName());
        }
        return conversion;
    }

    /**
     * 테이블에 대상 단위가 있는지 확인.
     *
     * @param target 대상 단위
     * @return 지원하면 true
     */
    public static boolean supports(WaveUnit target) {
        return target != null && TABLE.containsKey(target);
    }
}
