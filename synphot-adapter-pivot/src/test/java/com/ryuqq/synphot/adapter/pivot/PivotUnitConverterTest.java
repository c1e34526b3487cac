package com.ryuqq.synphot.adapter.pivot;

import com.ryuqq.synphot.core.constant.PhysicalConstants;
import com.ryuqq.synphot.core.exception.MalformedInputException;
import com.ryuqq.synphot.core.exception.MissingReferenceSpectrumException;
import com.ryuqq.synphot.core.exception.NonFiniteResultException;
import com.ryuqq.synphot.core.exception.UnknownUnitException;
import com.ryuqq.synphot.core.spi.ReferenceSpectrum;
import com.ryuqq.synphot.core.unit.FluxUnit;
import com.ryuqq.synphot.core.unit.UnitCategory;
import com.ryuqq.synphot.core.unit.WaveUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.ryuqq.synphot.core.constant.PhysicalConstants.H;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.HC;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.HSTAREA;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * PivotUnitConverter 유닛 테스트.
 *
 * <p>기준 단위 경유 변환의 핵심 동작을 검증합니다:</p>
 * <ul>
 *   <li>파장/플럭스 2단계 변환</li>
 *   <li>보조 입력 (구간 폭, 기준 플럭스) 계산</li>
 *   <li>입력 유효성 검증</li>
 *   <li>비유한 결과 정책</li>
 * </ul>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PivotUnitConverterTest {

    @Mock
    private ReferenceSpectrum referenceSpectrum;

    private PivotUnitConverter converter;

    @BeforeEach
    void setUp() {
        converter = new PivotUnitConverter(referenceSpectrum);
    }

    // ============================================================
    // 1. 파장 변환
    // ============================================================

    @Test
    void convertWave_angstrom_to_hz는_광속을_파장으로_나눔() {
        double[] result = converter.convertWave(new double[]{5000.0}, WaveUnit.ANGSTROM, WaveUnit.HZ);

        assertThat(result).hasSize(1);
        assertThat(result[0]).isEqualTo(PhysicalConstants.C / 5000.0);
        assertThat(result[0]).isCloseTo(5.99584916e14, within(1e5));
    }

    @Test
    void convertWave_hz_to_angstrom() {
        double[] result = converter.convertWave(new double[]{5000.0}, WaveUnit.HZ, WaveUnit.ANGSTROM);

        assertThat(result[0]).isEqualTo(PhysicalConstants.C / 5000.0);
    }

    @Test
    void convertWave_미터계_단위_간_변환은_angstrom을_경유함() {
        double[] result = converter.convertWave(new double[]{500.0, 656.3}, WaveUnit.NM, WaveUnit.MICRON);

        assertThat(result[0]).isCloseTo(0.5, within(1e-15));
        assertThat(result[1]).isCloseTo(0.6563, within(1e-15));
    }

    @Test
    void convertWave_내림차순_입력도_허용됨() {
        double[] hz = {1.0e15, 6.0e14, 4.0e14};

        double[] result = converter.convertWave(hz, WaveUnit.HZ, WaveUnit.NM);

        assertThat(result).hasSize(3);
        assertThat(result[0]).isLessThan(result[1]).isLessThan(result[2]);
    }

    @Test
    void convertWave_항등변환도_새_배열_반환() {
        double[] wave = {1000.0, 2000.0};

        double[] result = converter.convertWave(wave, WaveUnit.ANGSTROM, WaveUnit.ANGSTROM);

        assertThat(result).isNotSameAs(wave).containsExactly(1000.0, 2000.0);
    }

    @Test
    void convertWave_스칼라() {
        assertThat(converter.convertWave(1.0, WaveUnit.MICRON, WaveUnit.NM)).isEqualTo(1000.0);
    }

    @Test
    void convertWave_이름_기반_변환은_별칭을_해석함() {
        double[] result = converter.convertWave(new double[]{5000.0}, "Angstroms", "um");

        assertThat(result[0]).isCloseTo(0.5, within(1e-15));
    }

    @Test
    void convertWave_단위가_null이면_IllegalArgumentException() {
        assertThatThrownBy(() -> converter.convertWave(new double[]{1.0}, null, WaveUnit.NM))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("from cannot be null");
        assertThatThrownBy(() -> converter.convertWave(new double[]{1.0}, WaveUnit.NM, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("to cannot be null");
    }

    @Test
    void convertWave_빈_배열이면_MalformedInputException() {
        assertThatThrownBy(() -> converter.convertWave(new double[0], WaveUnit.NM, WaveUnit.M))
            .isInstanceOf(MalformedInputException.class);
        assertThatThrownBy(() -> converter.convertWave((double[]) null, WaveUnit.NM, WaveUnit.M))
            .isInstanceOf(MalformedInputException.class);
    }

    // ============================================================
    // 2. 플럭스 변환
    // ============================================================

    @Test
    void convertFlux_flam_to_fnu는_photlam을_경유함() {
        double[] wave = {4000.0, 5000.0};
        double[] flam = {1.0e-15, 2.0e-15};

        double[] fnu = converter.convertFlux(wave, flam, FluxUnit.FLAM, FluxUnit.FNU);

        for (int i = 0; i < wave.length; i++) {
            double photlam = flam[i] * wave[i] / HC;
            assertThat(fnu[i]).isCloseTo(H * photlam * wave[i], within(Math.abs(fnu[i]) * 1e-12));
        }
        verifyNoInteractions(referenceSpectrum);
    }

    @Test
    void convertFlux_photlam_항등변환은_복사본을_반환함() {
        double[] wave = {4000.0, 5000.0};
        double[] flux = {0.1, 0.2};

        double[] result = converter.convertFlux(wave, flux, FluxUnit.PHOTLAM, FluxUnit.PHOTLAM);
        result[0] = 99.0;

        assertThat(result).isNotSameAs(flux);
        assertThat(flux).containsExactly(0.1, 0.2);
    }

    @Test
    void convertFlux_counts는_구간폭과_면적을_곱함() {
        double[] wave = {0.0, 10.0, 30.0};
        double[] photlam = {1.0, 1.0, 1.0};

        double[] counts = converter.convertFlux(wave, photlam, FluxUnit.PHOTLAM, FluxUnit.COUNTS);

        assertThat(counts[0]).isEqualTo(10.0 * HSTAREA);
        assertThat(counts[1]).isEqualTo(15.0 * HSTAREA);
        assertThat(counts[2]).isEqualTo(20.0 * HSTAREA);
    }

    @Test
    void convertFlux_vegamag은_기준_스펙트럼을_한번만_조회함() {
        double[] wave = {4000.0, 5000.0, 6000.0};
        double[] photlam = {0.02, 0.002, 0.0002};
        when(referenceSpectrum.resample(any())).thenReturn(new double[]{0.02, 0.02, 0.02});

        double[] vegamag = converter.convertFlux(wave, photlam, FluxUnit.PHOTLAM, FluxUnit.VEGAMAG);

        assertThat(vegamag[0]).isCloseTo(0.0, within(1e-12));
        assertThat(vegamag[1]).isCloseTo(2.5, within(1e-12));
        assertThat(vegamag[2]).isCloseTo(5.0, within(1e-12));

        ArgumentCaptor<double[]> gridCaptor = ArgumentCaptor.forClass(double[].class);
        verify(referenceSpectrum, times(1)).resample(gridCaptor.capture());
        assertThat(gridCaptor.getValue()).containsExactly(4000.0, 5000.0, 6000.0);
    }

    @Test
    void convertFlux_vegamag_to_flam() {
        double[] wave = {4000.0, 5000.0};
        double[] vegamag = {0.0, 2.5};
        when(referenceSpectrum.resample(any())).thenReturn(new double[]{0.03, 0.01});

        double[] flam = converter.convertFlux(wave, vegamag, FluxUnit.VEGAMAG, FluxUnit.FLAM);

        assertThat(flam[0]).isCloseTo(HC * 0.03 / 4000.0, within(HC * 0.03 / 4000.0 * 1e-12));
        assertThat(flam[1]).isCloseTo(HC * 0.001 / 5000.0, within(HC * 0.001 / 5000.0 * 1e-9));
    }

    @Test
    void convertFlux_obmag은_기준_스펙트럼을_사용하지_않음() {
        double[] wave = {4000.0, 5000.0, 6000.0};
        double[] photlam = {0.01, 0.01, 0.01};

        converter.convertFlux(wave, photlam, FluxUnit.PHOTLAM, FluxUnit.OBMAG);

        verifyNoInteractions(referenceSpectrum);
    }

    @Test
    void convertFlux_이름_기반_변환() {
        double[] wave = {5000.0};
        double[] flux = {1.0 / (H * 5000.0)};

        double[] abmag = converter.convertFlux(wave, flux, "PHOTLAM", "ABMag");

        assertThat(abmag[0]).isCloseTo(PhysicalConstants.ABZERO, within(1e-9));
    }

    @Test
    void convertFlux_이름의_범주가_다르면_UnknownUnitException() {
        assertThatThrownBy(() -> converter.convertFlux(new double[]{1.0}, new double[]{1.0}, "nm", "flam"))
            .isInstanceOf(UnknownUnitException.class)
            .hasMessageContaining("nm");
    }

    @Test
    void resolveUnit_범주별_해석() {
        assertThat(converter.resolveUnit("um", UnitCategory.WAVE)).isEqualTo(WaveUnit.MICRON);
        assertThat(converter.resolveUnit("Jy", UnitCategory.FLUX)).isEqualTo(FluxUnit.JY);
    }

    // ============================================================
    // 3. 입력 검증
    // ============================================================

    @Test
    void convertFlux_길이가_다르면_MalformedInputException() {
        assertThatThrownBy(() -> converter.convertFlux(
                new double[]{1.0, 2.0}, new double[]{1.0}, FluxUnit.FLAM, FluxUnit.FNU))
            .isInstanceOf(MalformedInputException.class)
            .hasMessageContaining("wave: 2")
            .hasMessageContaining("flux: 1");
    }

    @Test
    void convertFlux_구간폭이_필요한데_오름차순이_아니면_MalformedInputException() {
        assertThatThrownBy(() -> converter.convertFlux(
                new double[]{3.0, 2.0, 1.0}, new double[]{1.0, 1.0, 1.0}, FluxUnit.PHOTLAM, FluxUnit.COUNTS))
            .isInstanceOf(MalformedInputException.class)
            .hasMessageContaining("strictly increasing");
    }

    @Test
    void convertFlux_구간폭이_필요한데_샘플이_1개면_MalformedInputException() {
        assertThatThrownBy(() -> converter.convertFlux(
                new double[]{5000.0}, new double[]{1.0}, FluxUnit.COUNTS, FluxUnit.FLAM))
            .isInstanceOf(MalformedInputException.class)
            .hasMessageContaining("at least 2");
    }

    @Test
    void convertFlux_보조입력이_필요없으면_정렬되지_않은_격자도_허용됨() {
        double[] result = converter.convertFlux(
            new double[]{6000.0, 4000.0}, new double[]{1.0, 1.0}, FluxUnit.PHOTLAM, FluxUnit.FLAM);

        assertThat(result).hasSize(2);
    }

    @Test
    void convertFlux_기준_스펙트럼_길이가_다르면_MalformedInputException() {
        when(referenceSpectrum.resample(any())).thenReturn(new double[]{0.02});

        assertThatThrownBy(() -> converter.convertFlux(
                new double[]{4000.0, 5000.0}, new double[]{0.0, 0.0}, FluxUnit.VEGAMAG, FluxUnit.PHOTLAM))
            .isInstanceOf(MalformedInputException.class)
            .hasMessageContaining("length 1");
    }

    @Test
    void convertFlux_기준_스펙트럼이_null을_반환하면_MalformedInputException() {
        when(referenceSpectrum.resample(any())).thenReturn(null);

        assertThatThrownBy(() -> converter.convertFlux(
                new double[]{4000.0, 5000.0}, new double[]{0.0, 0.0}, FluxUnit.VEGAMAG, FluxUnit.PHOTLAM))
            .isInstanceOf(MalformedInputException.class)
            .hasMessageContaining("returned null");
    }

    @Test
    void convertFlux_기준_스펙트럼이_없으면_vegamag_변환_실패() {
        PivotUnitConverter withoutReference = new PivotUnitConverter();

        assertThat(withoutReference.hasReferenceSpectrum()).isFalse();
        assertThatThrownBy(() -> withoutReference.convertFlux(
                new double[]{4000.0, 5000.0}, new double[]{0.1, 0.1}, FluxUnit.FLAM, FluxUnit.VEGAMAG))
            .isInstanceOf(MissingReferenceSpectrumException.class)
            .hasMessageContaining("vegamag");
    }

    @Test
    void constructor_config가_null이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new PivotUnitConverter(referenceSpectrum, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }

    // ============================================================
    // 4. 비유한 결과 정책
    // ============================================================

    @Test
    void convertFlux_PROPAGATE_정책이면_0_플럭스의_등급은_Infinity() {
        double[] abmag = converter.convertFlux(
            new double[]{5000.0}, new double[]{0.0}, FluxUnit.PHOTLAM, FluxUnit.ABMAG);

        assertThat(abmag[0]).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void convertFlux_REJECT_정책이면_NonFiniteResultException() {
        PivotUnitConverter strict = new PivotUnitConverter(
            referenceSpectrum, new ConverterConfig().withNonFinitePolicy(NonFinitePolicy.REJECT));

        NonFiniteResultException exception = assertThrows(
            NonFiniteResultException.class,
            () -> strict.convertFlux(
                new double[]{4000.0, 5000.0}, new double[]{0.1, -0.1}, FluxUnit.PHOTLAM, FluxUnit.STMAG)
        );
        assertThat(exception.getIndex()).isEqualTo(1);
        assertThat(exception.getMessage()).contains("sample 1").contains("stmag");
    }

    @Test
    void convertWave_REJECT_정책이면_0_파장의_주파수_거부() {
        PivotUnitConverter strict = new PivotUnitConverter(
            null, new ConverterConfig().withNonFinitePolicy(NonFinitePolicy.REJECT));

        assertThatThrownBy(() -> strict.convertWave(new double[]{0.0}, WaveUnit.ANGSTROM, WaveUnit.HZ))
            .isInstanceOf(NonFiniteResultException.class);
    }

    @Test
    void convertFlux_입력_배열을_변경하지_않음() {
        double[] wave = {4000.0, 5000.0, 6000.0};
        double[] flux = {1.0, 2.0, 3.0};
        when(referenceSpectrum.resample(any())).thenAnswer(invocation -> {
            double[] grid = invocation.getArgument(0);
            grid[0] = -1.0;
            return new double[]{1.0, 1.0, 1.0};
        });

        converter.convertFlux(wave, flux, FluxUnit.VEGAMAG, FluxUnit.COUNTS);

        assertThat(wave).containsExactly(4000.0, 5000.0, 6000.0);
        assertThat(flux).containsExactly(1.0, 2.0, 3.0);
    }
}
