package com.ryuqq.lbson.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 프로세스 전역 출력 모드.
 *
 * <p>출력 모드는 호출마다 선택하는 옵션이 아니라 시작 시점에 한 번 결정되는 설정입니다.
 * {@link #configure(LbsonConfig)}로 명시적으로 설치하거나, 설치 전에 처음 조회되면
 * {@link LbsonConfig#fromSystemProperties()}로 결정됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>한 번 결정된 모드는 다른 모드로 바꿀 수 없음 (같은 모드 재설치는 허용)</li>
 *   <li>데이터로부터 모드를 추론하지 않음</li>
 * </ul>
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public final class Rendering {

    private static final Logger log = LoggerFactory.getLogger(Rendering.class);

    private static final Rendering GLOBAL = new Rendering();

    private RenderMode mode;

    Rendering() {
    }

    /**
     * 시작 시점에 출력 모드 설치.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     * @throws IllegalStateException 이미 다른 모드가 결정된 경우
     */
    public static void configure(LbsonConfig config) {
        GLOBAL.install(config);
    }

    /**
     * 현재 출력 모드 조회.
     *
     * @return 결정된 출력 모드
     */
    public static RenderMode mode() {
        return GLOBAL.current();
    }

    synchronized void install(LbsonConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        RenderMode requested = config.renderMode();
        if (mode != null && mode != requested) {
            throw new IllegalStateException(
                String.format("Render mode already resolved: %s → %s", mode, requested)
            );
        }
        if (mode == null) {
            announce(requested);
        }
        mode = requested;
    }

    synchronized RenderMode current() {
        if (mode == null) {
            install(LbsonConfig.fromSystemProperties());
        }
        return mode;
    }

    private static void announce(RenderMode mode) {
        if (mode == RenderMode.DEBUG) {
            log.warn("LBSON debug rendering enabled: labeled content will appear in string output");
        } else {
            log.debug("LBSON render mode resolved: {}", mode);
        }
    }
}
