package com.ryuqq.synphot.adapter.pivot;

import com.ryuqq.synphot.application.converter.UnitConverter;
import com.ryuqq.synphot.core.dispatch.AngstromDispatch;
import com.ryuqq.synphot.core.dispatch.FluxKernel;
import com.ryuqq.synphot.core.dispatch.PhotlamDispatch;
import com.ryuqq.synphot.core.exception.MalformedInputException;
import com.ryuqq.synphot.core.exception.MissingReferenceSpectrumException;
import com.ryuqq.synphot.core.exception.NonFiniteResultException;
import com.ryuqq.synphot.core.grid.DeltaWavelength;
import com.ryuqq.synphot.core.spi.ReferenceSpectrum;
import com.ryuqq.synphot.core.unit.AuxiliaryInput;
import com.ryuqq.synphot.core.unit.FluxUnit;
import com.ryuqq.synphot.core.unit.WaveUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.DoubleUnaryOperator;

/**
 * 기준 단위를 경유하는 UnitConverter 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>경계 검증 (null, 길이, 격자 정렬)</li>
 *   <li>보조 입력 1회 계산 (구간 폭, 기준 플럭스)</li>
 *   <li>샘플별: source.toCanonical → canonical dispatch(target)</li>
 *   <li>비유한 결과 정책 적용</li>
 * </ol>
 *
 * <p><strong>특성:</strong></p>
 * <ul>
 *   <li>Stateless 설계: 변환 간 공유 상태 없음 (thread-safe)</li>
 *   <li>입력 배열은 변경하지 않으며 항상 새 배열을 반환</li>
 *   <li>샘플 수가 parallelThreshold 이상이면 병렬 평가</li>
 * </ul>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public final class PivotUnitConverter implements UnitConverter {

    private static final Logger log = LoggerFactory.getLogger(PivotUnitConverter.class);

    private final ReferenceSpectrum referenceSpectrum;
    private final ConverterConfig config;

    /**
     * 생성자 (기준 스펙트럼 없음, 기본 설정).
     *
     * <p>vegamag 변환은 {@link MissingReferenceSpectrumException}으로 실패합니다.</p>
     */
    public PivotUnitConverter() {
        this(null, new ConverterConfig());
    }

    /**
     * 생성자 (기본 설정).
     *
     * @param referenceSpectrum 기준 스펙트럼 (null이면 vegamag 미지원)
     */
    public PivotUnitConverter(ReferenceSpectrum referenceSpectrum) {
        this(referenceSpectrum, new ConverterConfig());
    }

    /**
     * 생성자.
     *
     * @param referenceSpectrum 기준 스펙트럼 (null이면 vegamag 미지원)
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public PivotUnitConverter(ReferenceSpectrum referenceSpectrum, ConverterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.referenceSpectrum = referenceSpectrum;
        this.config = config;
    }

    @Override
    public double[] convertWave(double[] wave, WaveUnit from, WaveUnit to) {
        SampleValidator.requireSamples(wave, "wave");
        SampleValidator.requireUnit(from, "from");
        SampleValidator.requireUnit(to, "to");

        DoubleUnaryOperator toTarget = AngstromDispatch.lookup(to);
        boolean parallel = config.isParallel(wave.length);
        log.debug("Converting {} wave samples: {} → {} → {} (parallel: {})",
            wave.length, from, WaveUnit.ANGSTROM, to, parallel);

        double[] result = ElementwiseEvaluator.evaluate(
            wave.length,
            i -> toTarget.applyAsDouble(from.toAngstrom(wave[i])),
            parallel
        );
        return applyNonFinitePolicy(result, from + " → " + to);
    }

    @Override
    public double convertWave(double wave, WaveUnit from, WaveUnit to) {
        return convertWave(new double[]{wave}, from, to)[0];
    }

    @Override
    public double[] convertFlux(double[] wave, double[] flux, FluxUnit from, FluxUnit to) {
        SampleValidator.requireSamples(wave, "wave");
        SampleValidator.requireSamples(flux, "flux");
        SampleValidator.requireSameLength(wave, flux);
        SampleValidator.requireUnit(from, "from");
        SampleValidator.requireUnit(to, "to");

        FluxKernel toTarget = PhotlamDispatch.lookup(to);

        // 보조 입력은 변환 1회당 한 번만 계산
        double[] binWidth = requires(from, to, AuxiliaryInput.BIN_WIDTH) ? binWidth(wave) : null;
        double[] referenceFlux = requires(from, to, AuxiliaryInput.REFERENCE_FLUX) ? referenceFlux(wave, from, to) : null;
        double[] fromAux = auxiliaryFor(from, binWidth, referenceFlux);
        double[] toAux = auxiliaryFor(to, binWidth, referenceFlux);

        boolean parallel = config.isParallel(wave.length);
        log.debug("Converting {} flux samples: {} → {} → {} (parallel: {})",
            wave.length, from, FluxUnit.PHOTLAM, to, parallel);

        double[] result = ElementwiseEvaluator.evaluate(
            wave.length,
            i -> {
                double photlam = from.toPhotlam(wave[i], flux[i], valueAt(fromAux, i));
                return toTarget.apply(wave[i], photlam, valueAt(toAux, i));
            },
            parallel
        );
        return applyNonFinitePolicy(result, from + " → " + to);
    }

    /**
     * 구간 폭 계산 (엄격히 증가하는 격자 필요).
     */
    private double[] binWidth(double[] wave) {
        SampleValidator.requireAscending(wave);
        return DeltaWavelength.of(wave);
    }

    /**
     * 기준 스펙트럼 리샘플 및 결과 검증.
     *
     * @throws MissingReferenceSpectrumException 기준 스펙트럼이 설정되지 않은 경우
     * @throws MalformedInputException 리샘플 결과가 null이거나 길이가 다른 경우
     */
    private double[] referenceFlux(double[] wave, FluxUnit from, FluxUnit to) {
        if (referenceSpectrum == null) {
            FluxUnit unit = from.auxiliaryInput() == AuxiliaryInput.REFERENCE_FLUX ? from : to;
            throw new MissingReferenceSpectrumException(unit.unitName());
        }
        SampleValidator.requireAscending(wave);

        double[] resampled = referenceSpectrum.resample(wave.clone());
        if (resampled == null) {
            throw new MalformedInputException("Reference spectrum returned null");
        }
        if (resampled.length != wave.length) {
            throw new MalformedInputException(
                String.format("Reference spectrum length %d does not match wave grid length %d",
                    resampled.length, wave.length)
            );
        }
        return resampled;
    }

    private double[] applyNonFinitePolicy(double[] result, String route) {
        int index = ElementwiseEvaluator.firstNonFinite(result);
        if (index < 0) {
            return result;
        }
        if (config.nonFinitePolicy() == NonFinitePolicy.REJECT) {
            throw new NonFiniteResultException(index, result[index], route);
        }
        log.warn("Non-finite result {} at sample {} ({})", result[index], index, route);
        return result;
    }

    private static boolean requires(FluxUnit from, FluxUnit to, AuxiliaryInput input) {
        return from.auxiliaryInput() == input || to.auxiliaryInput() == input;
    }

    private static double[] auxiliaryFor(FluxUnit unit, double[] binWidth, double[] referenceFlux) {
        return switch (unit.auxiliaryInput()) {
            case NONE -> null;
            case BIN_WIDTH -> binWidth;
            case REFERENCE_FLUX -> referenceFlux;
        };
    }

    private static double valueAt(double[] aux, int index) {
        return aux == null ? Double.NaN : aux[index];
    }

    /**
     * 현재 설정 조회.
     *
     * @return 설정
     */
    public ConverterConfig getConfig() {
        return config;
    }

    /**
     * 기준 스펙트럼이 설정되어 있는지 확인.
     *
     * @return vegamag 변환 가능 여부
     */
    public boolean hasReferenceSpectrum() {
        return referenceSpectrum != null;
    }
}
