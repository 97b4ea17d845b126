package com.ryuqq.lbson.core.config;

/**
 * 레이블 값의 텍스트 출력 모드.
 *
 * <ul>
 *   <li>{@link #PROTECTED}: 운영 빌드. 레이블 내용은 절대 출력되지 않음</li>
 *   <li>{@link #DEBUG}: 개발 빌드 전용. 진단을 위해 보호된 내용까지 출력</li>
 * </ul>
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public enum RenderMode {

    /**
     * 보호 모드 (기본값).
     *
     * <p>{@code Value}는 placeholder를 출력하고, {@code Labeled}/{@code PolicyLabeled}의
     * 직접 출력은 오용으로 간주되어 {@link UnsupportedOperationException}을 발생시킵니다.</p>
     */
    PROTECTED,

    /**
     * 디버그 모드.
     *
     * <p>개발 빌드에서만 허용됩니다.</p>
     */
    DEBUG;

    /**
     * 설정 문자열로부터 모드 해석 (대소문자 무시).
     *
     * @param text "protected" 또는 "debug"
     * @return RenderMode
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static RenderMode parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("render mode cannot be null or blank");
        }
        for (RenderMode mode : values()) {
            if (mode.name().equalsIgnoreCase(text.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown render mode: " + text);
    }
}
