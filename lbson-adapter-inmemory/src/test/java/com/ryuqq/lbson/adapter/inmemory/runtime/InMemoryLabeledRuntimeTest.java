package com.ryuqq.lbson.adapter.inmemory.runtime;

import com.ryuqq.lbson.adapter.inmemory.label.SetLabel;
import com.ryuqq.lbson.core.config.RenderMode;
import com.ryuqq.lbson.core.spi.Labeled;
import com.ryuqq.lbson.core.spi.TrustedBridge;
import com.ryuqq.lbson.core.value.LabeledVal;
import com.ryuqq.lbson.core.value.Value;
import com.ryuqq.lbson.core.value.ValueRenderer;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryLabeledRuntime 테스트.
 *
 * @author LBSON Team
 * @since 1.0.0
 */
class InMemoryLabeledRuntimeTest {

    private InMemoryLabeledRuntime<SetLabel> runtime;
    private TrustedBridge<SetLabel> bridge;

    @BeforeEach
    void setUp() {
        runtime = new InMemoryLabeledRuntime<>();
        bridge = runtime.trustedBridge();
    }

    @Test
    void bridge_왕복시_레이블과_페이로드_보존() {
        // given
        SetLabel label = SetLabel.of("alice");

        // when
        Labeled<SetLabel, String> labeled = bridge.labelTCB(label, "secret");

        // then
        assertThat(labeled.label()).isEqualTo(label);
        assertThat(bridge.unlabelTCB(labeled)).isEqualTo("secret");
    }

    @Test
    void bridge_다른_런타임의_레이블_값은_거부() {
        Labeled<SetLabel, String> foreign = SetLabel::bottom;

        assertThatThrownBy(() -> bridge.unlabelTCB(foreign))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not created by this runtime");
    }

    @Test
    void bridge_null_레이블은_거부() {
        assertThatThrownBy(() -> bridge.labelTCB(null, "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 레이블_값의_동등성과_해시는_지원_안됨() {
        Labeled<SetLabel, Integer> labeled = bridge.labelTCB(SetLabel.of("a"), 1);

        assertThatThrownBy(() -> labeled.equals(labeled))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(labeled::hashCode)
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 보호_모드에서_레이블_값_출력은_거부() {
        Labeled<SetLabel, String> labeled = bridge.labelTCB(SetLabel.of("a"), "secret");

        assertThatThrownBy(labeled::toString)
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageNotContaining("secret");
    }

    @Test
    void 디버그_모드_런타임은_레이블과_페이로드를_출력() {
        // given
        InMemoryLabeledRuntime<SetLabel> debugRuntime = new InMemoryLabeledRuntime<>(() -> RenderMode.DEBUG);
        Labeled<SetLabel, String> labeled = debugRuntime.trustedBridge().labelTCB(SetLabel.of("a"), "secret");

        // when & then
        assertThat(labeled.toString()).isEqualTo("LabeledTCB SetLabel[a] secret");
    }

    @Test
    void 디버그_렌더러는_디버그_모드_런타임의_값을_출력() {
        // given
        InMemoryLabeledRuntime<SetLabel> debugRuntime = new InMemoryLabeledRuntime<>(() -> RenderMode.DEBUG);
        Labeled<SetLabel, BsonValue> labeled =
            debugRuntime.trustedBridge().labelTCB(SetLabel.of("a"), new BsonString("secret"));
        Value<SetLabel> value = new LabeledVal<SetLabel>(labeled);

        // when
        String rendered = ValueRenderer.of(RenderMode.DEBUG).render(value);

        // then
        assertThat(rendered).startsWith("LabeledTCB SetLabel[a]").contains("secret");
    }

    @Test
    void 전역_모드가_보호_모드이면_디버그_렌더러도_출력_거부() {
        // given
        Labeled<SetLabel, BsonValue> labeled = bridge.labelTCB(SetLabel.of("a"), new BsonString("secret"));
        Value<SetLabel> value = new LabeledVal<SetLabel>(labeled);

        // when & then
        assertThat(ValueRenderer.of(RenderMode.PROTECTED).render(value)).isEqualTo(ValueRenderer.HIDDEN);
        assertThatThrownBy(() -> ValueRenderer.of(RenderMode.DEBUG).render(value))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 렌더_모드_공급자는_필수() {
        assertThatThrownBy(() -> new InMemoryLabeledRuntime<SetLabel>(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ioTCB_결과_반환과_효과_카운트() {
        // when
        String first = runtime.ioTCB(() -> "one");
        Integer second = runtime.ioTCB(() -> 2);

        // then
        assertThat(first).isEqualTo("one");
        assertThat(second).isEqualTo(2);
        assertThat(runtime.effectCount()).isEqualTo(2);
    }

    @Test
    void ioTCB_예외는_전파되고_카운트되지_않음() {
        assertThatThrownBy(() -> runtime.ioTCB(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(runtime.effectCount()).isZero();
        assertThatThrownBy(() -> runtime.ioTCB(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ioTCB_동시_호출은_직렬화() throws Exception {
        // given
        int threads = 8;
        int perThread = 50;
        List<Integer> observed = Collections.synchronizedList(new ArrayList<>());
        int[] counter = {0};
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        // when
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    observed.add(runtime.ioTCB(() -> ++counter[0]));
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // then
        assertThat(runtime.effectCount()).isEqualTo(threads * perThread);
        assertThat(observed).doesNotHaveDuplicates().hasSize(threads * perThread);
    }
}
