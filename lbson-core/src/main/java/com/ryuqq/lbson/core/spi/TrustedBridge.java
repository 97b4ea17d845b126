package com.ryuqq.lbson.core.spi;

/**
 * 레이블 검사를 우회하는 신뢰 경계(TCB) 연산.
 *
 * <p>LBSON은 이 인터페이스를 값 변환(labeled 페이로드를 BSON 값으로 다시 감싸는 작업)에만
 * 사용합니다. 레이블은 항상 그대로 보존되며, 정책 집행 목적으로 사용되지 않습니다.</p>
 *
 * <p>일반 문서 조작 코드에는 노출되지 않으며,
 * {@link com.ryuqq.lbson.core.value.LabeledVals}가 내부적으로만 보관합니다.</p>
 *
 * @param <L> 레이블 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 * @see LabeledRuntime#trustedBridge()
 */
public interface TrustedBridge<L extends Label<L>> {

    /**
     * 레이블 검사 없이 레이블 값 생성.
     *
     * @param label 레이블
     * @param value 페이로드
     * @param <A> 페이로드 타입
     * @return 레이블 값
     * @throws IllegalArgumentException label이 null인 경우
     */
    <A> Labeled<L, A> labelTCB(L label, A value);

    /**
     * 레이블 검사 없이 페이로드 추출.
     *
     * @param labeled 레이블 값
     * @param <A> 페이로드 타입
     * @return 페이로드
     * @throws IllegalArgumentException labeled가 이 런타임이 만든 값이 아닌 경우
     */
    <A> A unlabelTCB(Labeled<L, A> labeled);
}
