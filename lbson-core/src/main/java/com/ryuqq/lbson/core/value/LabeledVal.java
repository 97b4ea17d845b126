package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.spi.Label;
import com.ryuqq.lbson.core.spi.Labeled;
import org.bson.BsonValue;

/**
 * 레이블이 붙은 BSON 값.
 *
 * <p><strong>동등성:</strong> 어떤 값과도, 자기 자신과도 같지 않습니다.
 * 이는 {@link Object#equals(Object)}의 반사성을 의도적으로 어기는 것으로,
 * 레이블 페이로드가 동등성 비교로 노출되지 않도록 합니다.</p>
 *
 * @param labeled 레이블 BSON 값 (null 불가)
 * @param <L> 레이블 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public record LabeledVal<L extends Label<L>>(Labeled<L, BsonValue> labeled) implements Value<L> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException labeled가 null인 경우
     */
    public LabeledVal {
        if (labeled == null) {
            throw new IllegalArgumentException("labeled cannot be null");
        }
    }

    @Override
    public boolean equals(Object o) {
        return false;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return ValueRenderer.current().render(this);
    }
}
