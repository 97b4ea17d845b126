package com.ryuqq.lbson.core.document;

import com.ryuqq.lbson.core.spi.Label;
import com.ryuqq.lbson.core.value.Val;
import com.ryuqq.lbson.core.value.Value;

import java.util.Optional;

/**
 * 문서의 최소 단위인 키-값 쌍.
 *
 * <p>동등성: 키가 같고 {@link Value#equals(Object)}가 true일 때만 같습니다.
 * 따라서 레이블 값을 가진 필드는 자기 자신을 포함해 어떤 필드와도 같지 않습니다.</p>
 *
 * @param key 필드 키 (null 불가)
 * @param value 필드 값 (null 불가)
 * @param <L> 레이블 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public record Field<L extends Label<L>>(String key, Value<L> value) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public Field {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * 타입 값으로 필드 생성 ({@code k =: v}).
     *
     * @param key 키
     * @param value 호스트 값
     * @param val 변환 인스턴스
     * @param <L> 레이블 타입
     * @param <T> 호스트 타입
     * @return Field 인스턴스
     * @throws IllegalArgumentException key, value, val 중 하나가 null인 경우
     */
    public static <L extends Label<L>, T> Field<L> of(String key, T value, Val<L, T> val) {
        if (val == null) {
            throw new IllegalArgumentException("val cannot be null");
        }
        return new Field<>(key, val.val(value));
    }

    /**
     * 값이 있을 때만 필드 하나짜리 문서를 생성 ({@code k =? v}).
     *
     * @param key 키
     * @param value 선택적 호스트 값
     * @param val 변환 인스턴스
     * @param <L> 레이블 타입
     * @param <T> 호스트 타입
     * @return 값이 없으면 빈 문서, 있으면 {@code [key =: value]}
     * @throws IllegalArgumentException value(Optional) 또는 val이 null인 경우
     */
    public static <L extends Label<L>, T> Document<L> optional(String key, Optional<T> value, Val<L, T> val) {
        if (value == null) {
            throw new IllegalArgumentException("optional value cannot be null");
        }
        return value
            .map(v -> Document.<L>of(of(key, v, val)))
            .orElseGet(Document::<L>empty);
    }

    /**
     * 키와 값이 모두 같을 때만 같음.
     *
     * <p>값 비교는 항상 {@link Value#equals(Object)}를 거칩니다. 같은 인스턴스라도
     * 레이블 값을 가진 필드는 같지 않습니다.</p>
     */
    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Field<?> other)) {
            return false;
        }
        return key.equals(other.key) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return key + ": " + value;
    }
}
