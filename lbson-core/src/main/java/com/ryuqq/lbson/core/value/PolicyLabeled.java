package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.spi.Label;
import com.ryuqq.lbson.core.spi.Labeled;

/**
 * 정책 레이블 값: 정책이 아직 적용되지 않았거나({@link Unapplied}), 이미 적용된({@link Applied}) 값.
 *
 * <p><strong>동등성 미지원:</strong> {@code equals}와 {@code hashCode}는 항상
 * {@link UnsupportedOperationException}을 던집니다. 호출 자체가 오용이며 즉시 드러나야 합니다.</p>
 *
 * <p><strong>출력:</strong> 디버그 모드에서는 PU는 페이로드를, PL은 레이블 값의 디버그 출력을
 * 반환합니다. 보호 모드에서는 {@link UnsupportedOperationException}을 던집니다.</p>
 *
 * @param <L> 레이블 타입
 * @param <A> 페이로드 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public sealed interface PolicyLabeled<L extends Label<L>, A> {

    /**
     * 정책이 적용되지 않은 값 생성 (PU).
     *
     * @param value 페이로드
     * @param <L> 레이블 타입
     * @param <A> 페이로드 타입
     * @return Unapplied 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <L extends Label<L>, A> PolicyLabeled<L, A> pu(A value) {
        return new Unapplied<>(value);
    }

    /**
     * 이미 레이블이 붙은 값으로 생성 (PL).
     *
     * @param labeled 레이블 값
     * @param <L> 레이블 타입
     * @param <A> 페이로드 타입
     * @return Applied 인스턴스
     * @throws IllegalArgumentException labeled가 null인 경우
     */
    static <L extends Label<L>, A> PolicyLabeled<L, A> pl(Labeled<L, A> labeled) {
        return new Applied<>(labeled);
    }

    /**
     * 정책이 적용되었는지 확인.
     *
     * @return {@link Applied}이면 true
     */
    default boolean isApplied() {
        return this instanceof Applied;
    }

    /**
     * 정책 미적용 (PU).
     *
     * @param value 페이로드 (null 불가)
     * @param <L> 레이블 타입
     * @param <A> 페이로드 타입
     */
    record Unapplied<L extends Label<L>, A>(A value) implements PolicyLabeled<L, A> {

        public Unapplied {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public boolean equals(Object o) {
            throw new UnsupportedOperationException("Equality of PolicyLabeled is not supported");
        }

        @Override
        public int hashCode() {
            throw new UnsupportedOperationException("Hashing of PolicyLabeled is not supported");
        }

        @Override
        public String toString() {
            return ValueRenderer.current().render(this);
        }
    }

    /**
     * 정책 적용됨 (PL).
     *
     * @param labeled 레이블 값 (null 불가)
     * @param <L> 레이블 타입
     * @param <A> 페이로드 타입
     */
    record Applied<L extends Label<L>, A>(Labeled<L, A> labeled) implements PolicyLabeled<L, A> {

        public Applied {
            if (labeled == null) {
                throw new IllegalArgumentException("labeled cannot be null");
            }
        }

        @Override
        public boolean equals(Object o) {
            throw new UnsupportedOperationException("Equality of PolicyLabeled is not supported");
        }

        @Override
        public int hashCode() {
            throw new UnsupportedOperationException("Hashing of PolicyLabeled is not supported");
        }

        @Override
        public String toString() {
            return ValueRenderer.current().render(this);
        }
    }
}
