package com.ryuqq.lbson.core.document;

import com.ryuqq.lbson.core.outcome.Fail;
import com.ryuqq.lbson.core.outcome.Ok;
import com.ryuqq.lbson.core.outcome.Outcome;
import com.ryuqq.lbson.core.spi.Label;
import com.ryuqq.lbson.core.value.Val;
import com.ryuqq.lbson.core.value.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 필드의 순서 있는 나열인 LBSON 문서.
 *
 * <p><strong>불변성:</strong> 모든 연산은 새 문서를 반환합니다.</p>
 *
 * <p><strong>중복 키:</strong> 키의 유일성은 호출자의 관례이며 검증하지 않습니다.
 * 중복이 있으면 조회는 첫 번째 필드를, merge와 exclude는 첫 번째 위치를 기준으로 동작합니다.</p>
 *
 * <p><strong>조회 강도:</strong></p>
 * <ul>
 *   <li>soft: {@link #look(String)}, {@link #lookup(String, Val)} → {@link Outcome}</li>
 *   <li>hard: {@link #valueAt(String)}, {@link #at(String, Val)} → 누락 시 {@link IllegalStateException}.
 *       스키마로 존재가 보장된 호출 지점 전용</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Document&lt;SetLabel&gt; user = Document.concat(
 *     Document.of(Field.of("name", "alice", Vals.plain(Primitives.STRING))),
 *     Field.optional("nick", nick, Vals.plain(Primitives.STRING))
 * );
 * String name = user.at("name", Vals.plain(Primitives.STRING));
 * </pre>
 *
 * @param <L> 레이블 타입
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public final class Document<L extends Label<L>> {

    private final List<Field<L>> fields;

    private Document(List<Field<L>> fields) {
        this.fields = fields;
    }

    /**
     * 필드 목록으로 문서 생성.
     *
     * @param fields 필드들 (순서 유지)
     * @param <L> 레이블 타입
     * @return Document 인스턴스
     * @throws IllegalArgumentException fields가 null이거나 null 필드를 포함하는 경우
     */
    @SafeVarargs
    public static <L extends Label<L>> Document<L> of(Field<L>... fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        return of(Arrays.asList(fields));
    }

    /**
     * 필드 목록으로 문서 생성.
     *
     * @param fields 필드 목록 (복사됨)
     * @param <L> 레이블 타입
     * @return Document 인스턴스
     * @throws IllegalArgumentException fields가 null이거나 null 필드를 포함하는 경우
     */
    public static <L extends Label<L>> Document<L> of(List<Field<L>> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        for (Field<L> field : fields) {
            if (field == null) {
                throw new IllegalArgumentException("fields cannot contain null");
            }
        }
        return new Document<>(Collections.unmodifiableList(new ArrayList<>(fields)));
    }

    /**
     * 빈 문서 생성.
     *
     * @param <L> 레이블 타입
     * @return 빈 Document
     */
    public static <L extends Label<L>> Document<L> empty() {
        return new Document<>(Collections.emptyList());
    }

    /**
     * 여러 문서를 순서대로 이어 붙임.
     *
     * <p>{@link Field#optional(String, Optional, Val)}로 만든 조각을 조립할 때 사용합니다.
     * 중복 키는 제거하지 않습니다.</p>
     *
     * @param documents 문서들
     * @param <L> 레이블 타입
     * @return 이어 붙인 Document
     * @throws IllegalArgumentException documents가 null이거나 null 문서를 포함하는 경우
     */
    @SafeVarargs
    public static <L extends Label<L>> Document<L> concat(Document<L>... documents) {
        if (documents == null) {
            throw new IllegalArgumentException("documents cannot be null");
        }
        List<Field<L>> all = new ArrayList<>();
        for (Document<L> document : documents) {
            if (document == null) {
                throw new IllegalArgumentException("documents cannot contain null");
            }
            all.addAll(document.fields);
        }
        return new Document<>(Collections.unmodifiableList(all));
    }

    /**
     * 필드 목록 조회.
     *
     * @return 수정 불가능한 필드 목록
     */
    public List<Field<L>> fields() {
        return fields;
    }

    /**
     * 키 목록 조회 (문서 순서, 중복 포함).
     *
     * @return 키 목록
     */
    public List<String> keys() {
        return fields.stream().map(Field::key).collect(Collectors.toUnmodifiableList());
    }

    /**
     * 필드 수 조회.
     *
     * @return 필드 수
     */
    public int size() {
        return fields.size();
    }

    /**
     * 빈 문서인지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * 키의 값 조회 (첫 번째 매칭).
     *
     * @param key 키
     * @return 값, 없으면 키를 담은 {@link Fail}
     */
    public Outcome<Value<L>> look(String key) {
        return find(key)
            .<Outcome<Value<L>>>map(field -> Ok.of(field.value()))
            .orElseGet(() -> Fail.keyNotFound(key));
    }

    /**
     * 키의 값을 조회해 기대 타입으로 변환.
     *
     * @param key 키
     * @param val 변환 인스턴스
     * @param <T> 기대 타입
     * @return 변환된 값, 키가 없거나 타입이 맞지 않으면 {@link Fail}
     * @throws IllegalArgumentException val이 null인 경우
     */
    public <T> Outcome<T> lookup(String key, Val<L, T> val) {
        if (val == null) {
            throw new IllegalArgumentException("val cannot be null");
        }
        return look(key).flatMap(val::cast);
    }

    /**
     * 키의 값 조회 (존재가 보장된 경우).
     *
     * @param key 키
     * @return 값
     * @throws IllegalStateException 키가 없는 경우
     */
    public Value<L> valueAt(String key) {
        return look(key).orElseThrow();
    }

    /**
     * 키의 값을 기대 타입으로 조회 (존재와 타입이 보장된 경우).
     *
     * @param key 키
     * @param val 변환 인스턴스
     * @param <T> 기대 타입
     * @return 변환된 값
     * @throws IllegalStateException 키가 없거나 타입이 맞지 않는 경우 (키, 기대 타입, 문서 포함)
     */
    public <T> T at(String key, Val<L, T> val) {
        Outcome<T> outcome = lookup(key, val);
        if (outcome instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new IllegalStateException(
            String.format("expected (\"%s\" :: %s) in %s", key, val.typeName(), this)
        );
    }

    /**
     * 주어진 키의 필드만 남김.
     *
     * <p>결과 순서는 문서가 아니라 {@code keys}의 순서를 따르며, 문서에 없는 키는 무시합니다.</p>
     *
     * @param keys 남길 키 목록
     * @return 새 Document
     * @throws IllegalArgumentException keys가 null인 경우
     */
    public Document<L> include(List<String> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        List<Field<L>> included = new ArrayList<>();
        for (String key : keys) {
            find(key).ifPresent(included::add);
        }
        return new Document<>(Collections.unmodifiableList(included));
    }

    /**
     * 주어진 키의 필드를 제외 (문서 순서 유지).
     *
     * @param keys 제외할 키 목록
     * @return 새 Document
     * @throws IllegalArgumentException keys가 null인 경우
     */
    public Document<L> exclude(Collection<String> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        List<Field<L>> remaining = fields.stream()
            .filter(field -> !keys.contains(field.key()))
            .collect(Collectors.toList());
        return new Document<>(Collections.unmodifiableList(remaining));
    }

    /**
     * 이 문서를 우선하여 {@code base}에 병합.
     *
     * <p>이 문서의 각 필드 {@code k := v}에 대해, {@code base}(병합 진행 중인 결과)에 {@code k}가 있으면
     * 첫 번째 위치의 값을 {@code v}로 바꾸고, 없으면 끝에 추가합니다.
     * 이 문서에 없는 {@code base}의 필드는 원래 위치에 그대로 남습니다.</p>
     *
     * <pre>
     * [a: 10].merge([a: 1, b: 2]) == [a: 10, b: 2]
     * [c: 3].merge([a: 1])        == [a: 1, c: 3]
     * </pre>
     *
     * @param base 병합 대상 문서
     * @return 새 Document
     * @throws IllegalArgumentException base가 null인 경우
     */
    public Document<L> merge(Document<L> base) {
        if (base == null) {
            throw new IllegalArgumentException("base cannot be null");
        }
        List<Field<L>> merged = new ArrayList<>(base.fields);
        for (Field<L> field : fields) {
            int index = indexOf(merged, field.key());
            if (index < 0) {
                merged.add(field);
            } else {
                merged.set(index, field);
            }
        }
        return new Document<>(Collections.unmodifiableList(merged));
    }

    private Optional<Field<L>> find(String key) {
        return fields.stream()
            .filter(field -> field.key().equals(key))
            .findFirst();
    }

    private static <L extends Label<L>> int indexOf(List<Field<L>> fields, String key) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).key().equals(key)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 필드 순서대로 {@link Field#equals(Object)}를 비교.
     *
     * <p>레이블 값을 가진 필드가 하나라도 있으면 자기 자신과도 같지 않습니다.</p>
     */
    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Document<?> document = (Document<?>) o;
        if (fields.size() != document.fields.size()) {
            return false;
        }
        for (int i = 0; i < fields.size(); i++) {
            if (!fields.get(i).equals(document.fields.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.stream()
            .map(Field::toString)
            .collect(Collectors.joining(", ", "[", "]"));
    }
}
