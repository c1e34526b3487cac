package com.ryuqq.synphot.core.constant;

/**
 * 단위 변환 공식에 사용되는 물리 상수.
 *
 * <p>모든 값은 CGS 단위계 기준이며, 파장은 Angstrom 단위로 표현합니다.</p>
 *
 * <p><strong>주의:</strong> {@link #HSTAREA}는 이 엔진의 고정 상수이며 설정으로 변경할 수 없습니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public final class PhysicalConstants {

    /**
     * 광속 (Angstrom/s).
     */
    public static final double C = 2.99792458e18;

    /**
     * 플랑크 상수 (erg·s).
     */
    public static final double H = 6.62620e-27;

    /**
     * H * C.
     */
    public static final double HC = H * C;

    /**
     * AB 등급 영점.
     */
    public static final double ABZERO = -48.60;

    /**
     * ST 등급 영점.
     */
    public static final double STZERO = -21.10;

    /**
     * 망원경 유효 집광 면적 (cm²).
     */
    public static final double HSTAREA = 45238.93416;

    /**
     * 자연로그 기반 등급 계수 (2.5 / ln 10, 소수점 6자리).
     */
    public static final double MAG_LN_FACTOR = 1.085736;

    // Utility class - prevent instantiation
    private PhysicalConstants() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
