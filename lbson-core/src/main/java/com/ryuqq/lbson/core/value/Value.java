package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.spi.Label;

/**
 * LBSON 필드의 값.
 *
 * <p>Value는 정확히 세 가지 variant 중 하나입니다:</p>
 * <ul>
 *   <li>{@link BsonVal}: 레이블이 없는 BSON 값 (plain)</li>
 *   <li>{@link LabeledVal}: 레이블이 붙은 BSON 값</li>
 *   <li>{@link PolicyLabeledVal}: 정책 레이블 값 (정책 적용 전/후)</li>
 * </ul>
 *
 * <p><strong>동등성:</strong> 두 값이 모두 {@link BsonVal}이고 페이로드가 같을 때만 같습니다.
 * 레이블이 관련된 비교는 자기 자신과의 비교를 포함해 항상 false입니다.
 * 레이블 페이로드는 일반 동등성으로 들여다볼 수 없어야 하기 때문입니다.</p>
 *
 * <p><strong>출력:</strong> {@link BsonVal}은 BSON 값을 출력합니다. 나머지 두 variant는
 * {@link com.ryuqq.lbson.core.config.RenderMode#DEBUG}에서만 내용을 출력하고,
 * 보호 모드에서는 {@link ValueRenderer#HIDDEN}을 출력합니다.</p>
 *
 * <p><strong>Variant 분기 예시:</strong></p>
 * <pre>
 * if (value instanceof BsonVal&lt;L&gt; plain) {
 *     BsonValue bson = plain.bson();
 * } else if (value instanceof LabeledVal&lt;L&gt; labeled) {
 *     L label = labeled.labeled().label();
 * } else if (value instanceof PolicyLabeledVal&lt;L&gt; policy) {
 *     boolean applied = policy.policyLabeled().isApplied();
 * }
 * </pre>
 *
 * @param <L> 레이블 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public sealed interface Value<L extends Label<L>> permits BsonVal, LabeledVal, PolicyLabeledVal {

    /**
     * plain BSON 값인지 확인.
     *
     * @return {@link BsonVal}이면 true
     */
    default boolean isPlain() {
        return this instanceof BsonVal;
    }

    /**
     * 레이블 값인지 확인.
     *
     * @return {@link LabeledVal}이면 true
     */
    default boolean isLabeled() {
        return this instanceof LabeledVal;
    }

    /**
     * 정책 레이블 값인지 확인.
     *
     * @return {@link PolicyLabeledVal}이면 true
     */
    default boolean isPolicyLabeled() {
        return this instanceof PolicyLabeledVal;
    }
}
