package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.fixture.StubRuntime;
import com.ryuqq.lbson.core.fixture.TestLabel;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Value 동등성 규칙 테스트.
 *
 * @author LBSON Team
 * @since 1.0.0
 */
class ValueTest {

    private final StubRuntime runtime = new StubRuntime();

    @Test
    void plain_같은_페이로드면_같음() {
        // Given
        Value<TestLabel> a = BsonVal.<TestLabel>of(new BsonString("x"));
        Value<TestLabel> b = BsonVal.<TestLabel>of(new BsonString("x"));

        // When & Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void plain_다른_페이로드면_다름() {
        assertNotEquals(BsonVal.<TestLabel>of(new BsonInt32(1)), BsonVal.<TestLabel>of(new BsonInt32(2)));
    }

    @Test
    @SuppressWarnings("EqualsWithItself")
    void labeled_자기_자신과도_같지_않음() {
        // Given
        Value<TestLabel> labeled = new LabeledVal<TestLabel>(runtime.label(TestLabel.LOW, new BsonInt32(1)));

        // When & Then
        assertFalse(labeled.equals(labeled));
    }

    @Test
    void labeled_같은_레이블_같은_페이로드여도_다름() {
        // Given
        Value<TestLabel> x = new LabeledVal<TestLabel>(runtime.label(TestLabel.LOW, new BsonInt32(1)));
        Value<TestLabel> y = new LabeledVal<TestLabel>(runtime.label(TestLabel.LOW, new BsonInt32(1)));

        // When & Then
        assertFalse(x.equals(y));
    }

    @Test
    @SuppressWarnings("EqualsWithItself")
    void policyLabeled_자기_자신과도_같지_않음() {
        // Given
        Value<TestLabel> policy = new PolicyLabeledVal<TestLabel>(PolicyLabeled.<TestLabel, BsonValue>pu(new BsonInt32(1)));

        // When & Then
        assertFalse(policy.equals(policy));
    }

    @Test
    void plain과_labeled는_다름() {
        Value<TestLabel> plain = BsonVal.<TestLabel>of(new BsonInt32(1));
        Value<TestLabel> labeled = new LabeledVal<TestLabel>(runtime.label(TestLabel.LOW, new BsonInt32(1)));

        assertFalse(plain.equals(labeled));
        assertFalse(labeled.equals(plain));
    }

    @Test
    void variant_판별() {
        Value<TestLabel> plain = BsonVal.<TestLabel>of(new BsonDocument());
        Value<TestLabel> labeled = new LabeledVal<TestLabel>(runtime.label(TestLabel.LOW, new BsonInt32(1)));
        Value<TestLabel> policy = new PolicyLabeledVal<TestLabel>(PolicyLabeled.<TestLabel, BsonValue>pu(new BsonInt32(1)));

        assertTrue(plain.isPlain());
        assertTrue(labeled.isLabeled());
        assertTrue(policy.isPolicyLabeled());
        assertFalse(plain.isLabeled());
        assertFalse(labeled.isPolicyLabeled());
    }

    @Test
    void null_페이로드는_거부() {
        assertThrows(IllegalArgumentException.class, () -> BsonVal.<TestLabel>of(null));
        assertThrows(IllegalArgumentException.class, () -> new LabeledVal<TestLabel>(null));
        assertThrows(IllegalArgumentException.class, () -> new PolicyLabeledVal<TestLabel>(null));
    }
}
