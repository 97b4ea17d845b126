package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.spi.Label;
import org.bson.BsonValue;

/**
 * 정책 레이블 BSON 값.
 *
 * <p>동등성과 출력 규칙은 {@link LabeledVal}과 같습니다.</p>
 *
 * @param policyLabeled 정책 레이블 BSON 값 (null 불가)
 * @param <L> 레이블 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public record PolicyLabeledVal<L extends Label<L>>(PolicyLabeled<L, BsonValue> policyLabeled) implements Value<L> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException policyLabeled가 null인 경우
     */
    public PolicyLabeledVal {
        if (policyLabeled == null) {
            throw new IllegalArgumentException("policyLabeled cannot be null");
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
