package com.ryuqq.synphot.core.dispatch;

import com.ryuqq.synphot.core.exception.UnsupportedConversionTargetException;
import com.ryuqq.synphot.core.unit.FluxUnit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.ryuqq.synphot.core.constant.PhysicalConstants.ABZERO;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.C;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.H;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.HC;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.HSTAREA;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.MAG_LN_FACTOR;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.STZERO;

/**
 * 기준 플럭스 단위(photlam)에서 각 플럭스 단위로의 변환 테이블.
 *
 * <p><strong>공식 (flux = photlam, aux = 보조 입력):</strong></p>
 * <pre>
 * flam    = HC * flux / wave
 * fnu     = H * flux * wave
 * photnu  = flux * wave² / C
 * jy      = 1e23 * H * flux * wave
 * mjy     = 1e26 * H * flux * wave
 * abmag   = -1.085736 * ln(H * flux * wave) + ABZERO
 * stmag   = -1.085736 * ln(H * C * flux / wave) + STZERO
 * obmag   = -1.085736 * ln(flux * Δwave * HSTAREA)
 * vegamag = -2.5 * log10(flux / referenceFlux)
 * counts  = flux * Δwave * HSTAREA
 * photlam = flux
 * </pre>
 *
 * <p>보조 입력의 종류는 대상 단위의 {@link FluxUnit#auxiliaryInput()}과 같습니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public final class PhotlamDispatch {

    private static final Map<FluxUnit, FluxKernel> TABLE;

    static {
        Map<FluxUnit, FluxKernel> table = new EnumMap<>(FluxUnit.class);
        table.put(FluxUnit.FLAM, (wave, flux, aux) -> HC * flux / wave);
        table.put(FluxUnit.FNU, (wave, flux, aux) -> H * flux * wave);
        table.put(FluxUnit.PHOTLAM, (wave, flux, aux) -> flux);
        table.put(FluxUnit.PHOTNU, (wave, flux, aux) -> flux * wave * wave / C);
        table.put(FluxUnit.JY, (wave, flux, aux) -> 1.0e+23 * H * flux * wave);
        table.put(FluxUnit.MJY, (wave, flux, aux) -> 1.0e+26 * H * flux * wave);
        table.put(FluxUnit.ABMAG, (wave, flux, aux) -> -MAG_LN_FACTOR * Math.log(H * flux * wave) + ABZERO);
        table.put(FluxUnit.STMAG, (wave, flux, aux) -> -MAG_LN_FACTOR * Math.log(H * C * flux / wave) + STZERO);
        table.put(FluxUnit.OBMAG, (wave, flux, aux) -> -MAG_LN_FACTOR * Math.log(flux * aux * HSTAREA));
        table.put(FluxUnit.VEGAMAG, (wave, flux, aux) -> -2.5 * Math.log10(flux / aux));
        table.put(FluxUnit.COUNTS, (wave, flux, aux) -> flux * aux * HSTAREA);
        TABLE = Collections.unmodifiableMap(table);
    }

    // Utility class - prevent instantiation
    private PhotlamDispatch() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 대상 단위의 변환 공식 조회.
     *
     * @param target 대상 플럭스 단위
     * @return photlam 샘플을 target 값으로 바꾸는 공식
     * @throws IllegalArgumentException target이 null인 경우
     * @throws UnsupportedConversionTargetException 테이블에 없는 경우
     */
    public static FluxKernel lookup(FluxUnit target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        FluxKernel kernel = TABLE.get(target);
        if (kernel == null) {
            throw new UnsupportedConversionTargetException(target.unitName());
        }
        return kernel;
    }

    public static boolean supports(FluxUnit target) {
        return target != null && TABLE.containsKey(target);
    }
}
