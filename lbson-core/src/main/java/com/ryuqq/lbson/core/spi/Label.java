package com.ryuqq.lbson.core.spi;

/**
 * 보안 레이블 격자(lattice)의 원소.
 *
 * <p>레이블은 값의 기밀성/무결성 분류를 나타내며, 부분 순서 {@link #canFlowTo(Label)}와
 * 최소 상계 {@link #join(Label)}, 최대 하계 {@link #meet(Label)}를 제공해야 합니다.</p>
 *
 * <p>레이블 검사와 권한(privilege) 판단은 외부 labeled-computation 런타임의 책임이며,
 * LBSON은 레이블을 비교하거나 해석하지 않고 값과 함께 운반할 뿐입니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>불변 객체여야 함</li>
 *   <li>{@code canFlowTo}는 반사적, 추이적, 반대칭적이어야 함</li>
 *   <li>{@code equals}/{@code hashCode}는 격자 원소의 동일성을 따라야 함</li>
 * </ul>
 *
 * @param <L> 구현 레이블 타입 (self type)
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public interface Label<L extends Label<L>> {

    /**
     * 이 레이블의 데이터가 {@code other} 레이블로 흐를 수 있는지 확인.
     *
     * @param other 대상 레이블
     * @return this ⊑ other 이면 true
     */
    boolean canFlowTo(L other);

    /**
     * 최소 상계 (least upper bound).
     *
     * @param other 다른 레이블
     * @return this ⊔ other
     */
    L join(L other);

    /**
     * 최대 하계 (greatest lower bound).
     *
     * @param other 다른 레이블
     * @return this ⊓ other
     */
    L meet(L other);
}
