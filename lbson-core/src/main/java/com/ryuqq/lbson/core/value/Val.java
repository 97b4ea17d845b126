package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.outcome.Fail;
import com.ryuqq.lbson.core.outcome.Ok;
import com.ryuqq.lbson.core.outcome.Outcome;
import com.ryuqq.lbson.core.spi.Label;

import java.util.Optional;

/**
 * 정적 타입 {@code T}와 {@link Value} 사이의 양방향 변환.
 *
 * <p>인스턴스는 호출 지점에서 명시적으로 선택합니다. 같은 호스트 값이 여러 인스턴스에
 * 해당할 수 있으므로 우선순위는 다음과 같습니다:</p>
 * <ol>
 *   <li>{@link Vals#value()}: {@code Value} 자체 (항등)</li>
 *   <li>{@link LabeledVals#labeled(Primitive)}: {@code Labeled<L, A>}</li>
 *   <li>{@link LabeledVals#policyLabeled(Primitive)}: {@code PolicyLabeled<L, A>}</li>
 *   <li>{@link Vals#plain(Primitive)}: BSON으로 표현 가능한 모든 타입 (fallback)</li>
 * </ol>
 *
 * @param <L> 레이블 타입
 * @param <T> 호스트 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public interface Val<L extends Label<L>, T> {

    /**
     * 호스트 값을 Value로 주입.
     *
     * @param value 호스트 값 (null 불가)
     * @return Value
     * @throws IllegalArgumentException value가 null인 경우
     */
    Value<L> val(T value);

    /**
     * Value를 호스트 값으로 변환 시도.
     *
     * <p>variant나 저장된 타입이 맞지 않으면 오류가 아니라 empty를 반환합니다.</p>
     *
     * @param value Value
     * @return 변환된 값, 맞지 않으면 empty
     */
    Optional<T> tryCast(Value<L> value);

    /**
     * 오류 메시지에 사용할 타입 이름.
     *
     * @return 타입 이름
     */
    String typeName();

    /**
     * Value를 호스트 값으로 변환.
     *
     * @param value Value
     * @return 성공이면 {@link Ok}, 맞지 않으면 기대 타입과 실제 값을 담은 {@link Fail}
     */
    default Outcome<T> cast(Value<L> value) {
        Optional<T> cast = tryCast(value);
        if (cast.isPresent()) {
            return Ok.of(cast.get());
        }
        return Fail.typeMismatch(typeName(), String.valueOf(value));
    }

    /**
     * Value를 호스트 값으로 변환 (타입이 보장된 호출 지점용).
     *
     * @param value Value
     * @return 변환된 값
     * @throws IllegalStateException 타입이 맞지 않는 경우
     */
    default T typed(Value<L> value) {
        return cast(value).orElseThrow();
    }
}
