package com.ryuqq.lbson.core.outcome;

import java.util.Optional;
import java.util.function.Function;

/**
 * 복구 가능한 실패.
 *
 * <p>키가 문서에 없거나, 값의 variant/타입이 기대와 다른 경우를 나타냅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>{@link ErrorCodes#KEY_NOT_FOUND}: "expected \"age\""</li>
 *   <li>{@link ErrorCodes#TYPE_MISMATCH}: "expected Integer: \"forty\""</li>
 * </ul>
 *
 * @param errorCode 오류 코드 (예: LBSON-404)
 * @param message 진단 메시지 (누락된 키 또는 기대 타입과 실제 값)
 * @param <T> 기대했던 값 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public record Fail<T>(
    String errorCode,
    String message
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Fail 생성.
     *
     * @param errorCode 오류 코드
     * @param message 진단 메시지
     * @param <T> 기대했던 값 타입
     * @return Fail 인스턴스
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public static <T> Fail<T> of(String errorCode, String message) {
        return new Fail<>(errorCode, message);
    }

    /**
     * 키 누락 실패 생성.
     *
     * @param key 찾지 못한 키
     * @param <T> 기대했던 값 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> keyNotFound(String key) {
        return new Fail<>(ErrorCodes.KEY_NOT_FOUND, "expected \"" + key + "\"");
    }

    /**
     * 타입 불일치 실패 생성.
     *
     * @param expectedType 기대 타입 이름
     * @param actual 실제 값의 출력 형태
     * @param <T> 기대했던 값 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> typeMismatch(String expectedType, String actual) {
        return new Fail<>(ErrorCodes.TYPE_MISMATCH, "expected " + expectedType + ": " + actual);
    }

    @Override
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        return new Fail<>(errorCode, message);
    }

    @Override
    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        return new Fail<>(errorCode, message);
    }

    @Override
    public Optional<T> toOptional() {
        return Optional.empty();
    }

    @Override
    public T orElseThrow() {
        throw new IllegalStateException("[" + errorCode + "] " + message);
    }
}
