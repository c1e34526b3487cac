package com.ryuqq.synphot.adapter.pivot;

/**
 * 변환 결과에 NaN/Infinity가 포함된 경우의 처리 정책.
 *
 * @author Synphot Team
 * @since 1.0.0
 */
public enum NonFinitePolicy {

    /**
     * 비유한 값을 그대로 반환 (경고 로그만 남김). 기본값.
     */
    PROPAGATE,

    /**
     * {@link com.ryuqq.synphot.core.exception.NonFiniteResultException}으로 거부.
     */
    REJECT
}
