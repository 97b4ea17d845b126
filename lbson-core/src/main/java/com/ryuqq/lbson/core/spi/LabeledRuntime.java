package com.ryuqq.lbson.core.spi;

import java.util.function.Supplier;

/**
 * Labeled computation 런타임 SPI.
 *
 * <p>레이블 격자 집행, 권한 검사, 스케줄링은 이 런타임의 책임입니다.
 * LBSON이 요구하는 것은 두 가지뿐입니다:</p>
 * <ul>
 *   <li>{@link #trustedBridge()}: 값 변환 경로에서 레이블을 보존한 채 페이로드를 다시 감싸기</li>
 *   <li>{@link #ioTCB(Supplier)}: 유일한 부수효과 연산(ObjectId 생성)을 계산 순서 안에서 실행</li>
 * </ul>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>{@code ioTCB}는 감싸는 계산의 효과 순서를 지켜야 함</li>
 *   <li>Thread-safe: 여러 스레드에서 호출 가능해야 함</li>
 * </ul>
 *
 * @param <L> 레이블 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public interface LabeledRuntime<L extends Label<L>> {

    /**
     * 신뢰 경계 브리지 조회.
     *
     * @return 이 런타임의 {@link TrustedBridge}
     */
    TrustedBridge<L> trustedBridge();

    /**
     * 부수효과가 있는 동작을 현재 계산의 순서 안에서 실행.
     *
     * @param action 실행할 동작
     * @param <T> 결과 타입
     * @return 동작의 결과
     * @throws IllegalArgumentException action이 null인 경우
     */
    <T> T ioTCB(Supplier<T> action);
}
