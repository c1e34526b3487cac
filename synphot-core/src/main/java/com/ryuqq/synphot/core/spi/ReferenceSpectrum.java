package com.ryuqq.synphot.core.spi;

/**
 * 기준성(예: Vega) 스펙트럼 SPI.
 *
 * <p>vegamag 변환은 기준성 플럭스로 정규화되므로, 임의의 파장 격자에
 * 리샘플된 기준 플럭스가 필요합니다. 코어는 기준 스펙트럼을 생성하거나 로드하거나
 * 캐시하지 않으며, 이 인터페이스를 통해 주입받습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>반환 배열은 waveGrid와 같은 길이, 같은 순서</li>
 *   <li>값은 photlam 단위</li>
 *   <li>waveGrid를 변경하지 않음</li>
 *   <li>Thread-safe: 여러 스레드에서 동시에 호출될 수 있음</li>
 * </ul>
 *
 * <p>원격이거나 비동기인 구현이라도 이 메서드는 결과가 준비될 때까지 블로킹해야 합니다.</p>
 *
 * @author Synphot Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReferenceSpectrum {

    /**
     * 기준 스펙트럼을 파장 격자에 리샘플.
     *
     * @param waveGrid 대상 파장 격자 (angstrom, 오름차순)
     * @return 격자의 각 파장에서의 기준 플럭스 (photlam)
     */
    double[] resample(double[] waveGrid);
}
