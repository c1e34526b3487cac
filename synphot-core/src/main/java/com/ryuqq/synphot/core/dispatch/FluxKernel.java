package com.ryuqq.synphot.core.dispatch;

/**
 * 샘플 하나에 대한 플럭스 변환 공식.
 *
 * @author Synphot Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FluxKernel {

    /**
     * 샘플 하나 변환.
     *
     * @param wave 파장 (angstrom)
     * @param flux 원본 단위의 플럭스
     * @param aux 보조 입력 값 (구간 폭 또는 기준 플럭스, 불필요하면 무시)
     * @return 대상 단위의 값
     */
    double apply(double wave, double flux, double aux);
}
