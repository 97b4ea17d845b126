package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.spi.Label;
import com.ryuqq.lbson.core.spi.LabeledRuntime;
import org.bson.types.ObjectId;

import java.time.Instant;

/**
 * ObjectId 생성과 조회.
 *
 * <p>ObjectId 생성은 이 계층의 유일한 부수효과 연산이며, 런타임의
 * {@link LabeledRuntime#ioTCB(java.util.function.Supplier)} 안에서 실행됩니다.</p>
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public final class ObjectIds {

    // Utility class - prevent instantiation
    private ObjectIds() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 새 ObjectId 생성.
     *
     * @param runtime labeled computation 런타임
     * @param <L> 레이블 타입
     * @return 새 ObjectId
     * @throws IllegalArgumentException runtime이 null인 경우
     */
    public static <L extends Label<L>> ObjectId genObjectId(LabeledRuntime<L> runtime) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        return runtime.ioTCB(ObjectId::new);
    }

    /**
     * ObjectId에 포함된 생성 시각 (초 단위).
     *
     * @param objectId ObjectId
     * @return 생성 시각
     * @throws IllegalArgumentException objectId가 null인 경우
     */
    public static Instant timestamp(ObjectId objectId) {
        if (objectId == null) {
            throw new IllegalArgumentException("objectId cannot be null");
        }
        return Instant.ofEpochSecond(objectId.getTimestamp());
    }
}
