package com.ryuqq.lbson.adapter.inmemory.runtime;

import com.ryuqq.lbson.core.config.RenderMode;
import com.ryuqq.lbson.core.config.Rendering;
import com.ryuqq.lbson.core.spi.Label;
import com.ryuqq.lbson.core.spi.Labeled;
import com.ryuqq.lbson.core.spi.LabeledRuntime;
import com.ryuqq.lbson.core.spi.TrustedBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link LabeledRuntime} SPI for testing and reference purposes.
 *
 * <p>레이블 검사나 권한 집행은 하지 않습니다. 신뢰 경계 연산과 효과 순서만 제공합니다.</p>
 *
 * <p><strong>효과 순서:</strong> {@link #ioTCB(Supplier)}는 하나의 락 아래에서 순차 실행되며,
 * 실행 횟수를 {@link #effectCount()}로 확인할 수 있습니다.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>IFC 집행 없음 (current label, clearance 없음)</li>
 *   <li>다른 런타임이 만든 {@link Labeled}는 열 수 없음</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryLabeledRuntime&lt;SetLabel&gt; runtime = new InMemoryLabeledRuntime&lt;&gt;();
 * LabeledVals&lt;SetLabel&gt; labeledVals = new LabeledVals&lt;&gt;(runtime);
 * ObjectId id = ObjectIds.genObjectId(runtime);
 * </pre>
 *
 * @param <L> 레이블 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public class InMemoryLabeledRuntime<L extends Label<L>> implements LabeledRuntime<L> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLabeledRuntime.class);

    private final ReentrantLock effectLock = new ReentrantLock();
    private final AtomicLong effects = new AtomicLong();
    private final TrustedBridge<L> bridge = new Bridge();
    private final Supplier<RenderMode> renderMode;

    /**
     * 프로세스 전역 렌더 모드({@link Rendering#mode()})를 따르는 런타임 생성.
     */
    public InMemoryLabeledRuntime() {
        this(Rendering::mode);
    }

    /**
     * 렌더 모드 공급자를 지정해 런타임 생성.
     *
     * @param renderMode 레이블 값 출력 시 확인할 모드
     */
    InMemoryLabeledRuntime(Supplier<RenderMode> renderMode) {
        if (renderMode == null) {
            throw new IllegalArgumentException("renderMode cannot be null");
        }
        this.renderMode = renderMode;
    }

    @Override
    public TrustedBridge<L> trustedBridge() {
        return bridge;
    }

    @Override
    public <T> T ioTCB(Supplier<T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        effectLock.lock();
        try {
            T result = action.get();
            long sequence = effects.incrementAndGet();
            log.debug("ioTCB effect #{} completed", sequence);
            return result;
        } finally {
            effectLock.unlock();
        }
    }

    /**
     * 지금까지 실행된 효과 수 조회.
     *
     * @return ioTCB 완료 횟수
     */
    public long effectCount() {
        return effects.get();
    }

    private final class Bridge implements TrustedBridge<L> {

        @Override
        public <A> Labeled<L, A> labelTCB(L label, A value) {
            if (label == null) {
                throw new IllegalArgumentException("label cannot be null");
            }
            return new InMemoryLabeled<>(label, value, renderMode);
        }

        @Override
        public <A> A unlabelTCB(Labeled<L, A> labeled) {
            if (!(labeled instanceof InMemoryLabeled)) {
                throw new IllegalArgumentException(
                    "Labeled value was not created by this runtime: "
                        + (labeled == null ? "null" : labeled.getClass().getName())
                );
            }
            return ((InMemoryLabeled<L, A>) labeled).payload();
        }
    }
}
