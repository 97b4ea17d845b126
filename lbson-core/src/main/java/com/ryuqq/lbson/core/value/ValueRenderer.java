package com.ryuqq.lbson.core.value;

import com.ryuqq.lbson.core.config.RenderMode;
import com.ryuqq.lbson.core.config.Rendering;
import com.ryuqq.lbson.core.spi.Label;
import org.bson.BsonValue;

/**
 * 출력 모드에 따른 값 렌더링.
 *
 * <p>{@link Value}와 {@link PolicyLabeled}의 {@code toString}은 전역 모드
 * ({@link Rendering#mode()})의 렌더러에 위임합니다.</p>
 *
 * <table>
 *   <caption>모드별 출력</caption>
 *   <tr><th>대상</th><th>PROTECTED</th><th>DEBUG</th></tr>
 *   <tr><td>BsonVal</td><td>BSON 값</td><td>BSON 값</td></tr>
 *   <tr><td>LabeledVal / PolicyLabeledVal</td><td>{@value #HIDDEN}</td><td>내용</td></tr>
 *   <tr><td>PolicyLabeled</td><td>UnsupportedOperationException</td><td>내용</td></tr>
 * </table>
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public final class ValueRenderer {

    /** 보호 모드에서 레이블 값 대신 출력되는 문자열. */
    public static final String HIDDEN = "{- HIDING DATA -} ";

    private static final ValueRenderer PROTECTED = new ValueRenderer(RenderMode.PROTECTED);
    private static final ValueRenderer DEBUG = new ValueRenderer(RenderMode.DEBUG);

    private final RenderMode mode;

    private ValueRenderer(RenderMode mode) {
        this.mode = mode;
    }

    /**
     * 지정한 모드의 렌더러 조회.
     *
     * @param mode 출력 모드
     * @return ValueRenderer
     * @throws IllegalArgumentException mode가 null인 경우
     */
    public static ValueRenderer of(RenderMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        return mode == RenderMode.DEBUG ? DEBUG : PROTECTED;
    }

    /**
     * 전역 모드의 렌더러 조회.
     *
     * @return ValueRenderer
     */
    public static ValueRenderer current() {
        return of(Rendering.mode());
    }

    /**
     * 렌더러의 모드 조회.
     *
     * @return 출력 모드
     */
    public RenderMode mode() {
        return mode;
    }

    /**
     * 값 렌더링.
     *
     * @param value 값
     * @param <L> 레이블 타입
     * @return 출력 문자열
     */
    public <L extends Label<L>> String render(Value<L> value) {
        if (value instanceof BsonVal<L> plain) {
            return BsonFormat.render(plain.bson());
        }
        if (mode == RenderMode.PROTECTED) {
            return HIDDEN;
        }
        if (value instanceof LabeledVal<L> labeled) {
            return String.valueOf(labeled.labeled());
        }
        return render(((PolicyLabeledVal<L>) value).policyLabeled());
    }

    /**
     * 정책 레이블 값 렌더링.
     *
     * @param policyLabeled 정책 레이블 값
     * @param <L> 레이블 타입
     * @param <A> 페이로드 타입
     * @return 출력 문자열 (디버그 모드)
     * @throws UnsupportedOperationException 보호 모드인 경우
     */
    public <L extends Label<L>, A> String render(PolicyLabeled<L, A> policyLabeled) {
        if (mode == RenderMode.PROTECTED) {
            throw new UnsupportedOperationException("Rendering of PolicyLabeled is not supported");
        }
        if (policyLabeled instanceof PolicyLabeled.Unapplied<L, A> unapplied) {
            return unapplied.value() instanceof BsonValue bson
                ? BsonFormat.render(bson)
                : String.valueOf(unapplied.value());
        }
        return String.valueOf(((PolicyLabeled.Applied<L, A>) policyLabeled).labeled());
    }
}
