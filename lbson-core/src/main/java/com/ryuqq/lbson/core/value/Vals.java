package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.spi.Label;

import java.util.Optional;

/**
 * 레이블 브리지가 필요 없는 {@link Val} 인스턴스.
 *
 * <ul>
 *   <li>{@link #value()}: 항등 변환, 항상 성공</li>
 *   <li>{@link #plain(Primitive)}: {@link BsonVal}만 매칭하는 fallback</li>
 * </ul>
 *
 * <p>레이블/정책 레이블 인스턴스는 {@link LabeledVals}에 있습니다.</p>
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public final class Vals {

    // Utility class - prevent instantiation
    private Vals() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Value 자체에 대한 항등 인스턴스.
     *
     * @param <L> 레이블 타입
     * @return 항등 Val
     */
    public static <L extends Label<L>> Val<L, Value<L>> value() {
        return new Val<>() {
            @Override
            public Value<L> val(Value<L> value) {
                if (value == null) {
                    throw new IllegalArgumentException("value cannot be null");
                }
                return value;
            }

            @Override
            public Optional<Value<L>> tryCast(Value<L> value) {
                return Optional.ofNullable(value);
            }

            @Override
            public String typeName() {
                return "Value";
            }
        };
    }

    /**
     * plain BSON 값 인스턴스.
     *
     * @param primitive 호스트 타입 브리지
     * @param <L> 레이블 타입
     * @param <T> 호스트 타입
     * @return {@link BsonVal}만 매칭하는 Val
     * @throws IllegalArgumentException primitive가 null인 경우
     */
    public static <L extends Label<L>, T> Val<L, T> plain(Primitive<T> primitive) {
        if (primitive == null) {
            throw new IllegalArgumentException("primitive cannot be null");
        }
        return new Val<>() {
            @Override
            public Value<L> val(T value) {
                return BsonVal.<L>of(primitive.toBson(value));
            }

            @Override
            public Optional<T> tryCast(Value<L> value) {
                if (value instanceof BsonVal<L> plain) {
                    return primitive.fromBson(plain.bson());
                }
                return Optional.empty();
            }

            @Override
            public String typeName() {
                return primitive.typeName();
            }
        };
    }

    /**
     * 호스트 클래스의 기본 브리지로 plain 인스턴스 생성.
     *
     * @param type 호스트 클래스
     * @param <L> 레이블 타입
     * @param <T> 호스트 타입
     * @return plain Val
     * @throws IllegalArgumentException BSON으로 표현할 수 없는 클래스인 경우
     * @see Primitives#forClass(Class)
     */
    public static <L extends Label<L>, T> Val<L, T> plain(Class<T> type) {
        Primitive<T> primitive = Primitives.forClass(type)
            .orElseThrow(() -> new IllegalArgumentException("No BSON primitive for " + type));
        return plain(primitive);
    }
}
