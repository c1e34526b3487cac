package com.ryuqq.synphot.core.unit;

import static com.ryuqq.synphot.core.constant.PhysicalConstants.ABZERO;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.C;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.H;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.HC;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.HSTAREA;
import static com.ryuqq.synphot.core.constant.PhysicalConstants.STZERO;

/**
 * 분광 플럭스 밀도 단위.
 *
 * <p>모든 플럭스 단위는 자신으로 표현된 샘플 하나를 기준 단위인 photlam
 * (photons cm⁻² s⁻¹ Å⁻¹)으로 변환할 줄 압니다. 변환은 파장에 의존하므로
 * 샘플 공식은 항상 (wave, flux, aux) 세 값을 받습니다.</p>
 *
 * <p><strong>aux 값:</strong> {@link #auxiliaryInput()}이 선언한 보조 입력의 해당 샘플 값.
 * {@link AuxiliaryInput#NONE}인 단위는 aux를 무시합니다.</p>
 *
 * <p>photlam에서 다른 단위로의 변환은 {@link com.ryuqq.synphot.core.dispatch.PhotlamDispatch}가 담당합니다.</p>
 *
 * <p><strong>비유한 값:</strong> 0 이하 플럭스의 등급 변환, 0 파장 등은 예외가 아니라
 * NaN/Infinity로 전파됩니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public enum FluxUnit implements UnitVariant {

    /** erg cm⁻² s⁻¹ Å⁻¹. */
    FLAM("flam", AuxiliaryInput.NONE) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return flux * wave / HC;
        }
    },

    /** erg cm⁻² s⁻¹ Hz⁻¹. */
    FNU("fnu", AuxiliaryInput.NONE) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return flux / wave / H;
        }
    },

    PHOTLAM("photlam", AuxiliaryInput.NONE) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return flux;
        }
    },

    /** photons cm⁻² s⁻¹ Hz⁻¹. */
    PHOTNU("photnu", AuxiliaryInput.NONE) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return C * flux / (wave * wave);
        }
    },

    /** 10⁻²³ erg cm⁻² s⁻¹ Hz⁻¹. */
    JY("jy", AuxiliaryInput.NONE) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return flux / wave * (1.0e-23 / H);
        }
    },

    /** 10⁻²⁶ erg cm⁻² s⁻¹ Hz⁻¹. */
    MJY("mjy", AuxiliaryInput.NONE) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return flux / wave * (1.0e-26 / H);
        }
    },

    ABMAG("abmag", AuxiliaryInput.NONE) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return 1.0 / (H * wave) * Math.pow(10.0, -0.4 * (flux - ABZERO));
        }
    },

    STMAG("stmag", AuxiliaryInput.NONE) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return wave / H / C * Math.pow(10.0, -0.4 * (flux - STZERO));
        }
    },

    OBMAG("obmag", AuxiliaryInput.BIN_WIDTH) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return Math.pow(10.0, -0.4 * flux) / (aux * HSTAREA);
        }
    },

    VEGAMAG("vegamag", AuxiliaryInput.REFERENCE_FLUX) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return aux * Math.pow(10.0, -0.4 * flux);
        }
    },

    COUNTS("counts", AuxiliaryInput.BIN_WIDTH) {
        @Override
        public double toPhotlam(double wave, double flux, double aux) {
            return flux / (aux * HSTAREA);
        }
    };

    private final String unitName;
    private final AuxiliaryInput auxiliaryInput;

    FluxUnit(String unitName, AuxiliaryInput auxiliaryInput) {
        this.unitName = unitName;
        this.auxiliaryInput = auxiliaryInput;
    }

    /**
     * 샘플 하나를 photlam으로 변환.
     *
     * @param wave 파장 (angstrom)
     * @param flux 이 단위의 플럭스 값
     * @param aux 보조 입력 값 ({@link #auxiliaryInput()} 참고)
     * @return photlam 값
     */
    public abstract double toPhotlam(double wave, double flux, double aux);

    /**
     * 이 단위가 요구하는 보조 입력 조회.
     *
     * @return 보조 입력 종류
     */
    public AuxiliaryInput auxiliaryInput() {
        return auxiliaryInput;
    }

    /**
     * 로그 스케일(등급) 단위인지 확인.
     *
     * @return abmag, stmag, obmag, vegamag이면 true
     */
    public boolean isMagnitude() {
        return this == ABMAG || this == STMAG || this == OBMAG || this == VEGAMAG;
    }

    @Override
    public String unitName() {
        return unitName;
    }

    @Override
    public UnitCategory category() {
        return UnitCategory.FLUX;
    }

    @Override
    public String toString() {
        return unitName;
    }
}
