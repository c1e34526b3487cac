package com.ryuqq.synphot.application.converter;

import com.ryuqq.synphot.core.unit.FluxUnit;
import com.ryuqq.synphot.core.unit.UnitCategory;
import com.ryuqq.synphot.core.unit.UnitVariant;
import com.ryuqq.synphot.core.unit.Units;
import com.ryuqq.synphot.core.unit.WaveUnit;

/**
 * 단위 변환 조정자.
 *
 * <p>원본 단위 → 기준 단위 → 대상 단위의 2단계 변환을 수행합니다.
 * 같은 범주의 두 단위 사이에 직접 변환 경로는 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * UnitConverter converter = new PivotUnitConverter(vegaSpectrum);
 *
 * double[] micron = converter.convertWave(wave, "angstrom", "um");
 * double[] abmag = converter.convertFlux(wave, flux, "flam", "abmag");
 * </pre>
 *
 * <p><strong>비유한 결과:</strong> 0 이하 플럭스의 등급 변환이나 0 파장은 기본적으로
 * NaN/Infinity로 전파되며, 입력 범위는 호출자가 책임집니다.
 * 구현체가 설정에 따라 이를 거부할 수 있습니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public interface UnitConverter {

    /**
     * 파장 배열 변환.
     *
     * @param wave 원본 단위의 파장 배열
     * @param from 원본 단위
     * @param to 대상 단위
     * @return 새 배열 (입력과 같은 길이, 같은 순서)
     * @throws IllegalArgumentException 단위가 null인 경우
     * @throws com.ryuqq.synphot.core.exception.MalformedInputException wave가 null이거나 비어있는 경우
     */
    double[] convertWave(double[] wave, WaveUnit from, WaveUnit to);

    /**
     * 파장 값 하나 변환.
     *
     * @param wave 원본 단위의 파장
     * @param from 원본 단위
     * @param to 대상 단위
     * @return 대상 단위의 파장
     */
    double convertWave(double wave, WaveUnit from, WaveUnit to);

    /**
     * 플럭스 배열 변환.
     *
     * <p>플럭스 변환은 파장에 의존하므로 angstrom 단위의 파장 격자가 함께 필요합니다.
     * photlam → photlam이라도 결과는 입력과 다른 배열입니다.</p>
     *
     * @param wave 파장 격자 (angstrom, 엄격히 증가)
     * @param flux 원본 단위의 플럭스 배열
     * @param from 원본 단위
     * @param to 대상 단위
     * @return 새 배열 (입력과 같은 길이, 같은 순서)
     * @throws IllegalArgumentException 단위가 null인 경우
     * @throws com.ryuqq.synphot.core.exception.MalformedInputException 배열이 유효하지 않은 경우
     * @throws com.ryuqq.synphot.core.exception.MissingReferenceSpectrumException vegamag인데 기준 스펙트럼이 없는 경우
     */
    double[] convertFlux(double[] wave, double[] flux, FluxUnit from, FluxUnit to);

    /**
     * 이름으로 지정한 파장 단위 간 변환.
     *
     * @param wave 원본 단위의 파장 배열
     * @param from 원본 단위 이름 (대소문자 무관, 별칭 허용)
     * @param to 대상 단위 이름
     * @return 새 배열
     * @throws com.ryuqq.synphot.core.exception.UnknownUnitException 이름을 해석할 수 없는 경우
     */
    default double[] convertWave(double[] wave, String from, String to) {
        return convertWave(wave, Units.wave(from), Units.wave(to));
    }

    /**
     * 이름으로 지정한 플럭스 단위 간 변환.
     *
     * @param wave 파장 격자 (angstrom)
     * @param flux 원본 단위의 플럭스 배열
     * @param from 원본 단위 이름
     * @param to 대상 단위 이름
     * @return 새 배열
     * @throws com.ryuqq.synphot.core.exception.UnknownUnitException 이름을 해석할 수 없는 경우
     */
    default double[] convertFlux(double[] wave, double[] flux, String from, String to) {
        return convertFlux(wave, flux, Units.flux(from), Units.flux(to));
    }

    /**
     * 범주를 지정한 단위 이름 해석.
     *
     * @param name 단위 이름
     * @param category 범주
     * @return 단위
     * @throws com.ryuqq.synphot.core.exception.UnknownUnitException 이름을 해석할 수 없는 경우
     */
    default UnitVariant resolveUnit(String name, UnitCategory category) {
        return Units.resolve(name, category);
    }
}
