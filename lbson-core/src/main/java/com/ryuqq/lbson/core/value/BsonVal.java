package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.spi.Label;
import org.bson.BsonValue;

/**
 * 레이블이 없는 BSON 값.
 *
 * <p>record 기본 동등성을 그대로 사용합니다 (페이로드가 같으면 같음).</p>
 *
 * @param bson BSON 값 (null 불가, BSON null은 {@link org.bson.BsonNull#VALUE})
 * @param <L> 레이블 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public record BsonVal<L extends Label<L>>(BsonValue bson) implements Value<L> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException bson이 null인 경우
     */
    public BsonVal {
        if (bson == null) {
            throw new IllegalArgumentException("bson cannot be null");
        }
    }

    /**
     * BsonVal 생성.
     *
     * @param bson BSON 값
     * @param <L> 레이블 타입
     * @return BsonVal 인스턴스
     */
    public static <L extends Label<L>> BsonVal<L> of(BsonValue bson) {
        return new BsonVal<>(bson);
    }

    @Override
    public String toString() {
        return BsonFormat.render(bson);
    }
}
