package com.ryuqq.lbson.core.outcome;

import java.util.Optional;
import java.util.function.Function;

/**
 * 복구 가능한 조회/변환 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 값이 존재하고 기대한 타입임</li>
 *   <li>{@link Fail}: 키가 없거나 타입이 맞지 않음 (진단 메시지 포함)</li>
 * </ul>
 *
 * <p>{@code look}, {@code lookup}, {@code cast}처럼 "soft" 연산이 반환하며,
 * 호출자는 실패를 명시적으로 처리해야 합니다. 처리할 필요가 없다고 확신하는 경우
 * {@link #orElseThrow()}로 치명적 오류로 바꿀 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;Integer&gt; age = doc.lookup("age", Vals.plain(Primitives.INT32));
 * if (age instanceof Ok&lt;Integer&gt; ok) {
 *     use(ok.value());
 * } else if (age instanceof Fail&lt;Integer&gt; fail) {
 *     log.warn("{}: {}", fail.errorCode(), fail.message());
 * }
 * </pre>
 *
 * @param <T> 성공 값의 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 성공 값에 함수를 적용.
     *
     * @param mapper 변환 함수
     * @param <R> 결과 타입
     * @return 성공이면 변환된 Ok, 실패면 같은 코드와 메시지의 Fail
     */
    <R> Outcome<R> map(Function<? super T, ? extends R> mapper);

    /**
     * 성공 값으로 다음 Outcome을 계산.
     *
     * @param mapper 다음 단계
     * @param <R> 결과 타입
     * @return 다음 단계의 결과, 또는 이 실패
     */
    <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper);

    /**
     * Optional로 변환 (실패 정보는 버림).
     *
     * @return 성공이면 값, 실패면 empty
     */
    Optional<T> toOptional();

    /**
     * 성공 값 조회, 실패면 치명적 오류.
     *
     * @return 성공 값
     * @throws IllegalStateException 실패인 경우 (메시지에 실패 사유 포함)
     */
    T orElseThrow();
}
