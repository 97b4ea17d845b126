package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.fixture.StubRuntime;
import com.ryuqq.lbson.core.fixture.TestLabel;
import com.ryuqq.lbson.core.outcome.ErrorCodes;
import com.ryuqq.lbson.core.outcome.Fail;
import com.ryuqq.lbson.core.outcome.Ok;
import com.ryuqq.lbson.core.outcome.Outcome;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Vals (항등, plain) 인스턴스 테스트.
 *
 * @author LBSON Team
 * @since 1.0.0
 */
class ValsTest {

    private final Val<TestLabel, Integer> int32 = Vals.plain(Primitives.INT32);

    @Test
    void plain_val은_BsonVal_생성() {
        // When
        Value<TestLabel> value = int32.val(7);

        // Then
        assertEquals(BsonVal.<TestLabel>of(new BsonInt32(7)), value);
        assertTrue(value.isPlain());
    }

    @Test
    void plain_cast_왕복() {
        assertEquals(Ok.of(7), int32.cast(int32.val(7)));
    }

    @Test
    void plain_tryCast_레이블_값은_empty() {
        // Given
        StubRuntime runtime = new StubRuntime();
        Value<TestLabel> labeled = new LabeledVal<TestLabel>(runtime.label(TestLabel.HIGH, new BsonInt32(7)));

        // When & Then
        assertThat(int32.tryCast(labeled)).isEmpty();
    }

    @Test
    void cast_타입_불일치면_기대_타입과_실제_값을_담은_Fail() {
        // Given
        Value<TestLabel> text = BsonVal.<TestLabel>of(new BsonString("forty"));

        // When
        Outcome<Integer> outcome = int32.cast(text);

        // Then
        assertThat(outcome).isInstanceOf(Fail.class);
        Fail<Integer> fail = (Fail<Integer>) outcome;
        assertEquals(ErrorCodes.TYPE_MISMATCH, fail.errorCode());
        assertEquals("expected Integer: \"forty\"", fail.message());
    }

    @Test
    void cast_레이블_값의_메시지에_내용이_노출되지_않음() {
        // Given
        StubRuntime runtime = new StubRuntime();
        Value<TestLabel> secret = new LabeledVal<TestLabel>(runtime.label(TestLabel.HIGH, new BsonString("s3cret")));

        // When
        Fail<Integer> fail = (Fail<Integer>) int32.cast(secret);

        // Then
        assertThat(fail.message())
            .doesNotContain("s3cret")
            .endsWith(ValueRenderer.HIDDEN);
    }

    @Test
    void typed_타입_불일치면_IllegalStateException() {
        assertThatThrownBy(() -> int32.typed(BsonVal.<TestLabel>of(new BsonString("x"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("expected Integer");
    }

    @Test
    void typed_성공() {
        assertEquals(5, int32.typed(BsonVal.<TestLabel>of(new BsonInt32(5))));
    }

    @Test
    void value_항등_인스턴스는_모든_variant를_통과() {
        // Given
        Val<TestLabel, Value<TestLabel>> identity = Vals.value();
        StubRuntime runtime = new StubRuntime();
        Value<TestLabel> plain = BsonVal.<TestLabel>of(new BsonInt32(1));
        Value<TestLabel> labeled = new LabeledVal<TestLabel>(runtime.label(TestLabel.LOW, new BsonInt32(1)));
        Value<TestLabel> policy = new PolicyLabeledVal<TestLabel>(PolicyLabeled.<TestLabel, BsonValue>pu(new BsonInt32(1)));

        // When & Then
        for (Value<TestLabel> value : List.of(plain, labeled, policy)) {
            assertSame(value, identity.val(value));
            assertSame(value, identity.tryCast(value).orElseThrow());
        }
        assertEquals("Value", identity.typeName());
    }

    @Test
    void plain_클래스로_브리지_선택() {
        // Given
        Val<TestLabel, String> string = Vals.plain(String.class);

        // When & Then
        assertEquals(Ok.of("a"), string.cast(string.val("a")));
        assertEquals("String", string.typeName());
    }

    @Test
    void plain_지원하지_않는_클래스면_예외() {
        assertThatThrownBy(() -> Vals.<TestLabel, Object>plain(Object.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No BSON primitive");
    }
}
