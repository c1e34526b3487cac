package com.ryuqq.synphot.adapter.pivot;

/**
 * PivotUnitConverter 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>parallelThreshold: 병렬 평가를 시작하는 샘플 수 (기본 10000)</li>
 *   <li>nonFinitePolicy: NaN/Infinity 결과 처리 정책 (기본 PROPAGATE)</li>
 * </ul>
 *
 * <p><strong>성능 튜닝 가이드:</strong></p>
 * <ul>
 *   <li>작은 스펙트럼이 대부분: 기본값 유지 (병렬화 오버헤드 회피)</li>
 *   <li>고해상도 스펙트럼(10⁵ 샘플 이상): 임계값 그대로 두면 자동으로 병렬 처리</li>
 *   <li>항상 순차 처리: parallelThreshold = Integer.MAX_VALUE</li>
 * </ul>
 *
 * @author Synphot Team
 * @since 1.0.0
 * @param parallelThreshold 병렬 평가 임계 샘플 수 (1 이상)
 * @param nonFinitePolicy 비유한 결과 처리 정책 (null 불가)
 */
public record ConverterConfig(int parallelThreshold, NonFinitePolicy nonFinitePolicy) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: parallelThreshold=10000, nonFinitePolicy=PROPAGATE</p>
     */
    public ConverterConfig() {
        this(10_000, NonFinitePolicy.PROPAGATE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConverterConfig {
        if (parallelThreshold <= 0) {
            throw new IllegalArgumentException(
                "parallelThreshold must be positive (current: " + parallelThreshold + ")"
            );
        }
        if (nonFinitePolicy == null) {
            throw new IllegalArgumentException("nonFinitePolicy cannot be null");
        }
    }

    /**
     * parallelThreshold만 변경한 새 인스턴스 생성.
     *
     * @param parallelThreshold 새로운 임계값
     * @return 새 ConverterConfig 인스턴스
     */
    public ConverterConfig withParallelThreshold(int parallelThreshold) {
        return new ConverterConfig(parallelThreshold, this.nonFinitePolicy);
    }

    /**
     * nonFinitePolicy만 변경한 새 인스턴스 생성.
     *
     * @param nonFinitePolicy 새로운 정책
     * @return 새 ConverterConfig 인스턴스
     */
    public ConverterConfig withNonFinitePolicy(NonFinitePolicy nonFinitePolicy) {
        return new ConverterConfig(this.parallelThreshold, nonFinitePolicy);
    }

    /**
     * 주어진 샘플 수에서 병렬 평가 여부.
     *
     * @param sampleCount 샘플 수
     * @return 임계값 이상이면 true
     */
    public boolean isParallel(int sampleCount) {
        return sampleCount >= parallelThreshold;
    }
}
