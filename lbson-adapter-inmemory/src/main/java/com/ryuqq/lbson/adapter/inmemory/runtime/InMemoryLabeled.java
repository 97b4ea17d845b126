package com.ryuqq.lbson.adapter.inmemory.runtime;

import com.ryuqq.lbson.core.config.RenderMode;
import com.ryuqq.lbson.core.config.Rendering;
import com.ryuqq.lbson.core.spi.Label;
import com.ryuqq.lbson.core.spi.Labeled;

import java.util.function.Supplier;

/**
 * {@link InMemoryLabeledRuntime}이 만드는 레이블 값.
 *
 * <p>페이로드는 같은 패키지의 런타임만 읽을 수 있습니다.
 * {@code equals}/{@code hashCode}는 지원하지 않으며, {@code toString}은
 * 런타임의 렌더 모드가 {@link RenderMode#DEBUG}일 때만 내용을 출력합니다.</p>
 *
 * <p>런타임의 렌더 모드는 기본적으로 프로세스 전역 {@link Rendering#mode()}입니다.
 * 호출한 렌더러의 모드는 보지 않으므로, 전역 모드가 PROTECTED이면
 * {@code ValueRenderer.of(DEBUG)}로 렌더링해도 이 값의 출력은 거부됩니다.</p>
 *
 * @param <L> 레이블 타입
 * @param <A> 페이로드 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public final class InMemoryLabeled<L extends Label<L>, A> implements Labeled<L, A> {

    private final L label;
    private final A payload;
    private final Supplier<RenderMode> renderMode;

    InMemoryLabeled(L label, A payload, Supplier<RenderMode> renderMode) {
        this.label = label;
        this.payload = payload;
        this.renderMode = renderMode;
    }

    @Override
    public L label() {
        return label;
    }

    A payload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        throw new UnsupportedOperationException("Equality of Labeled is not supported");
    }

    @Override
    public int hashCode() {
        throw new UnsupportedOperationException("Hashing of Labeled is not supported");
    }

    @Override
    public String toString() {
        if (renderMode.get() != RenderMode.DEBUG) {
            throw new UnsupportedOperationException("Rendering of Labeled is not supported");
        }
        return "LabeledTCB " + label + " " + payload;
    }
}
