package com.ryuqq.lbson.core.outcome;

/**
 * {@link Fail}의 오류 코드 상수.
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public final class ErrorCodes {

    /** 문서에 키가 없음. */
    public static final String KEY_NOT_FOUND = "LBSON-404";

    /** 값의 variant 또는 저장된 타입이 기대와 다름. */
    public static final String TYPE_MISMATCH = "LBSON-415";

    // Utility class - prevent instantiation
    private ErrorCodes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
