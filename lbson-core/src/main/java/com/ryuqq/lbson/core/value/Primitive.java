package com.ryuqq.lbson.core.value;

import org.bson.BsonValue;

import java.util.Optional;

/**
 * 호스트 타입과 BSON 값 사이의 브리지.
 *
 * <p>{@link Vals#plain(Primitive)}의 기반이며, {@link LabeledVals}가 레이블 페이로드를
 * 변환할 때도 사용합니다. 기본 제공 인스턴스는 {@link Primitives}에 있습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>왕복 법칙: {@code fromBson(toBson(x))}는 {@code x}와 같은 값을 반환해야 함</li>
 *   <li>{@code fromBson}은 변환할 수 없는 값에 대해 예외 대신 empty를 반환해야 함</li>
 * </ul>
 *
 * @param <T> 호스트 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public interface Primitive<T> {

    /**
     * 호스트 값을 BSON 값으로 변환.
     *
     * @param value 호스트 값 (null 불가)
     * @return BSON 값
     * @throws IllegalArgumentException value가 null이거나 BSON으로 표현할 수 없는 경우
     */
    BsonValue toBson(T value);

    /**
     * BSON 값을 호스트 값으로 변환 시도.
     *
     * @param bson BSON 값
     * @return 변환된 값, 표현할 수 없으면 empty
     */
    Optional<T> fromBson(BsonValue bson);

    /**
     * 오류 메시지에 사용할 타입 이름.
     *
     * @return 타입 이름 (예: "Integer", "List&lt;String&gt;")
     */
    String typeName();
}
