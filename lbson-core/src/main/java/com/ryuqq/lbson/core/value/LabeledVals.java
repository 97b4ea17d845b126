package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.spi.Label;
import com.ryuqq.lbson.core.spi.Labeled;
import com.ryuqq.lbson.core.spi.LabeledRuntime;
import com.ryuqq.lbson.core.spi.TrustedBridge;
import org.bson.BsonValue;

import java.util.Optional;

/**
 * 레이블/정책 레이블 값의 {@link Val} 인스턴스.
 *
 * <p>레이블 페이로드를 BSON 값으로 다시 감싸려면 {@link TrustedBridge}가 필요합니다.
 * 이 클래스는 런타임에서 받은 브리지를 내부에만 보관하며, 레이블은 변환 전후로 항상 같습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * LabeledVals&lt;SetLabel&gt; labeledVals = new LabeledVals&lt;&gt;(runtime);
 * Val&lt;SetLabel, Labeled&lt;SetLabel, String&gt;&gt; ssn = labeledVals.labeled(Primitives.STRING);
 *
 * Field&lt;SetLabel&gt; field = Field.of("ssn", labeledSsn, ssn);
 * Outcome&lt;Labeled&lt;SetLabel, String&gt;&gt; back = document.lookup("ssn", ssn);
 * </pre>
 *
 * @param <L> 레이블 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public final class LabeledVals<L extends Label<L>> {

    private final TrustedBridge<L> bridge;

    /**
     * 생성자.
     *
     * @param runtime labeled computation 런타임
     * @throws IllegalArgumentException runtime이 null이거나 브리지를 제공하지 않는 경우
     */
    public LabeledVals(LabeledRuntime<L> runtime) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        TrustedBridge<L> trustedBridge = runtime.trustedBridge();
        if (trustedBridge == null) {
            throw new IllegalArgumentException("runtime must provide a trusted bridge");
        }
        this.bridge = trustedBridge;
    }

    /**
     * 레이블 값 인스턴스.
     *
     * <p>{@code val}은 페이로드를 BSON으로 변환해 같은 레이블로 다시 감싼 {@link LabeledVal}을 만듭니다.
     * {@code tryCast}는 {@link LabeledVal}만 매칭하며, 페이로드가 {@code A}로 변환되지 않으면 empty입니다.</p>
     *
     * @param primitive 페이로드 브리지
     * @param <A> 페이로드 타입
     * @return Labeled Val
     * @throws IllegalArgumentException primitive가 null인 경우
     */
    public <A> Val<L, Labeled<L, A>> labeled(Primitive<A> primitive) {
        requirePrimitive(primitive);
        return new Val<>() {
            @Override
            public Value<L> val(Labeled<L, A> labeled) {
                if (labeled == null) {
                    throw new IllegalArgumentException("labeled cannot be null");
                }
                return new LabeledVal<L>(toBson(labeled, primitive));
            }

            @Override
            public Optional<Labeled<L, A>> tryCast(Value<L> value) {
                if (value instanceof LabeledVal<L> labeledVal) {
                    return fromBson(labeledVal.labeled(), primitive);
                }
                return Optional.empty();
            }

            @Override
            public String typeName() {
                return "Labeled<" + primitive.typeName() + ">";
            }
        };
    }

    /**
     * 정책 레이블 값 인스턴스.
     *
     * <p>PU와 PL 모두 처리하며 {@link PolicyLabeledVal}만 매칭합니다.</p>
     *
     * @param primitive 페이로드 브리지
     * @param <A> 페이로드 타입
     * @return PolicyLabeled Val
     * @throws IllegalArgumentException primitive가 null인 경우
     */
    public <A> Val<L, PolicyLabeled<L, A>> policyLabeled(Primitive<A> primitive) {
        requirePrimitive(primitive);
        return new Val<>() {
            @Override
            public Value<L> val(PolicyLabeled<L, A> policyLabeled) {
                if (policyLabeled instanceof PolicyLabeled.Unapplied<L, A> unapplied) {
                    return new PolicyLabeledVal<L>(PolicyLabeled.<L, BsonValue>pu(primitive.toBson(unapplied.value())));
                }
                if (policyLabeled instanceof PolicyLabeled.Applied<L, A> applied) {
                    return new PolicyLabeledVal<L>(PolicyLabeled.<L, BsonValue>pl(toBson(applied.labeled(), primitive)));
                }
                throw new IllegalArgumentException("policyLabeled cannot be null");
            }

            @Override
            public Optional<PolicyLabeled<L, A>> tryCast(Value<L> value) {
                if (!(value instanceof PolicyLabeledVal<L> policyVal)) {
                    return Optional.empty();
                }
                PolicyLabeled<L, BsonValue> stored = policyVal.policyLabeled();
                if (stored instanceof PolicyLabeled.Unapplied<L, BsonValue> unapplied) {
                    return primitive.fromBson(unapplied.value()).map(payload -> PolicyLabeled.<L, A>pu(payload));
                }
                PolicyLabeled.Applied<L, BsonValue> applied = (PolicyLabeled.Applied<L, BsonValue>) stored;
                return fromBson(applied.labeled(), primitive).map(labeled -> PolicyLabeled.<L, A>pl(labeled));
            }

            @Override
            public String typeName() {
                return "PolicyLabeled<" + primitive.typeName() + ">";
            }
        };
    }

    private <A> Labeled<L, BsonValue> toBson(Labeled<L, A> labeled, Primitive<A> primitive) {
        A payload = bridge.unlabelTCB(labeled);
        return bridge.labelTCB(labeled.label(), primitive.toBson(payload));
    }

    private <A> Optional<Labeled<L, A>> fromBson(Labeled<L, BsonValue> labeled, Primitive<A> primitive) {
        L label = labeled.label();
        return primitive.fromBson(bridge.unlabelTCB(labeled))
            .map(payload -> bridge.labelTCB(label, payload));
    }

    private static void requirePrimitive(Primitive<?> primitive) {
        if (primitive == null) {
            throw new IllegalArgumentException("primitive cannot be null");
        }
    }
}
