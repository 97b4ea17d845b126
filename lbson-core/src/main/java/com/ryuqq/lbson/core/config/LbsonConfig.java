package com.ryuqq.lbson.core.config;

/**
 * LBSON 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>renderMode: 레이블 값 출력 모드 (기본 PROTECTED)</li>
 * </ul>
 *
 * <p>시스템 프로퍼티 {@value #RENDER_MODE_PROPERTY}로 지정할 수 있으며,
 * {@code debug}는 개발 빌드에서만 사용해야 합니다.</p>
 *
 * @author LBSON Team
 * @since 1.0.0
 * @param renderMode 출력 모드 (null 불가)
 */
public record LbsonConfig(RenderMode renderMode) {

    /** 출력 모드 시스템 프로퍼티 이름. */
    public static final String RENDER_MODE_PROPERTY = "lbson.render.mode";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: renderMode=PROTECTED</p>
     */
    public LbsonConfig() {
        this(RenderMode.PROTECTED);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException renderMode가 null인 경우
     */
    public LbsonConfig {
        if (renderMode == null) {
            throw new IllegalArgumentException("renderMode cannot be null");
        }
    }

    /**
     * 시스템 프로퍼티로부터 설정 생성.
     *
     * <p>프로퍼티가 없으면 기본 설정을 반환합니다.</p>
     *
     * @return LbsonConfig 인스턴스
     * @throws IllegalArgumentException 프로퍼티 값이 유효하지 않은 경우
     */
    public static LbsonConfig fromSystemProperties() {
        String mode = System.getProperty(RENDER_MODE_PROPERTY);
        if (mode == null || mode.isBlank()) {
            return new LbsonConfig();
        }
        return new LbsonConfig(RenderMode.parse(mode));
    }

    /**
     * renderMode만 변경한 새 인스턴스 생성.
     *
     * @param renderMode 새로운 출력 모드
     * @return 새 LbsonConfig 인스턴스
     */
    public LbsonConfig withRenderMode(RenderMode renderMode) {
        return new LbsonConfig(renderMode);
    }
}
