package com.ryuqq.lbson.core.outcome;

import java.util.Optional;
import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value 조회/변환된 값 (null 불가)
 * @param <T> 값 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Ok {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * Ok 생성.
     *
     * @param value 값
     * @param <T> 값 타입
     * @return Ok 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }

    @Override
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        return new Ok<>(mapper.apply(value));
    }

    @Override
    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        return mapper.apply(value);
    }

    @Override
    public Optional<T> toOptional() {
        return Optional.of(value);
    }

    @Override
    public T orElseThrow() {
        return value;
    }
}
