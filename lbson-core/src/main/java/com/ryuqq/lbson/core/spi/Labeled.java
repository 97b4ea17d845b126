package com.ryuqq.lbson.core.spi;

/**
 * 레이블과 페이로드의 쌍 (opaque).
 *
 * <p>페이로드는 공개 API로 읽을 수 없습니다. 내용은 외부 런타임의 강제 규칙을 거쳐서만
 * 읽을 수 있으며, LBSON 내부의 값 변환 경로에서는 {@link TrustedBridge}를 통해서만 접근합니다.</p>
 *
 * <p><strong>동등성과 출력:</strong> 구현체는 페이로드를 비교하거나 출력해서는 안 됩니다.
 * {@code equals}/{@code hashCode}는 {@link UnsupportedOperationException}을 던지고,
 * {@code toString}은 {@link com.ryuqq.lbson.core.config.Rendering} 모드를 따라야 합니다.</p>
 *
 * @param <L> 레이블 타입
 * @param <A> 페이로드 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public interface Labeled<L extends Label<L>, A> {

    /**
     * 이 값에 붙은 레이블 조회.
     *
     * @return 레이블 (null 불가)
     */
    L label();
}
