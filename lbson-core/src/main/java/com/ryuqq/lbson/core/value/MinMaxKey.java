package com.ryuqq.lbson.core.value;

/**
 * BSON MinKey / MaxKey.
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public enum MinMaxKey {

    /** 모든 BSON 값보다 작게 정렬됨. */
    MIN_KEY,

    /** 모든 BSON 값보다 크게 정렬됨. */
    MAX_KEY
}
