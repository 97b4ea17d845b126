package com.ryuqq.lbson.adapter.inmemory.label;

import com.ryuqq.lbson.core.spi.Label;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 비밀 주체(principal) 집합으로 표현한 기밀성 레이블.
 *
 * <p>집합이 클수록 더 비밀스러운 데이터입니다.</p>
 * <ul>
 *   <li>{@code canFlowTo}: 부분집합</li>
 *   <li>{@code join}: 합집합</li>
 *   <li>{@code meet}: 교집합</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * SetLabel pub = SetLabel.bottom();
 * SetLabel alice = SetLabel.of("alice");
 * pub.canFlowTo(alice);              // true
 * alice.join(SetLabel.of("bob"));    // {alice, bob}
 * </pre>
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public final class SetLabel implements Label<SetLabel> {

    private static final SetLabel BOTTOM = new SetLabel(Collections.emptySortedSet());

    private final Set<String> principals;

    private SetLabel(Set<String> principals) {
        this.principals = principals;
    }

    /**
     * 주체 목록으로 레이블 생성.
     *
     * @param principals 주체 이름들
     * @return SetLabel 인스턴스
     * @throws IllegalArgumentException principals가 null이거나 null/빈 이름을 포함하는 경우
     */
    public static SetLabel of(String... principals) {
        if (principals == null) {
            throw new IllegalArgumentException("principals cannot be null");
        }
        return of(Arrays.asList(principals));
    }

    /**
     * 주체 컬렉션으로 레이블 생성.
     *
     * @param principals 주체 이름들
     * @return SetLabel 인스턴스
     * @throws IllegalArgumentException principals가 null이거나 null/빈 이름을 포함하는 경우
     */
    public static SetLabel of(Collection<String> principals) {
        if (principals == null) {
            throw new IllegalArgumentException("principals cannot be null");
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String principal : principals) {
            if (principal == null || principal.isBlank()) {
                throw new IllegalArgumentException("principal cannot be null or blank");
            }
            sorted.add(principal);
        }
        return new SetLabel(Collections.unmodifiableSortedSet(sorted));
    }

    /**
     * 격자의 최하위 원소 (공개 데이터).
     *
     * @return 빈 집합 레이블
     */
    public static SetLabel bottom() {
        return BOTTOM;
    }

    /**
     * 주체 집합 조회.
     *
     * @return 정렬된 수정 불가 집합
     */
    public Set<String> principals() {
        return principals;
    }

    @Override
    public boolean canFlowTo(SetLabel other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return other.principals.containsAll(principals);
    }

    @Override
    public SetLabel join(SetLabel other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        TreeSet<String> union = new TreeSet<>(principals);
        union.addAll(other.principals);
        return new SetLabel(Collections.unmodifiableSortedSet(union));
    }

    @Override
    public SetLabel meet(SetLabel other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        TreeSet<String> intersection = new TreeSet<>(principals);
        intersection.retainAll(other.principals);
        return new SetLabel(Collections.unmodifiableSortedSet(intersection));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SetLabel that = (SetLabel) o;
        return principals.equals(that.principals);
    }

    @Override
    public int hashCode() {
        return principals.hashCode();
    }

    @Override
    public String toString() {
        return "SetLabel" + principals;
    }
}
