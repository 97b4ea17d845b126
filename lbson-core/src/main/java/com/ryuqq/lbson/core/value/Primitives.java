package com.ryuqq.lbson.core.value;

import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonBinarySubType;
import org.bson.BsonBoolean;
import org.bson.BsonDateTime;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonJavaScript;
import org.bson.BsonMaxKey;
import org.bson.BsonMinKey;
import org.bson.BsonNull;
import org.bson.BsonObjectId;
import org.bson.BsonRegularExpression;
import org.bson.BsonString;
import org.bson.BsonSymbol;
import org.bson.BsonTimestamp;
import org.bson.BsonType;
import org.bson.BsonValue;
import org.bson.types.Binary;
import org.bson.types.Code;
import org.bson.types.ObjectId;
import org.bson.types.Symbol;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * 기본 제공 {@link Primitive} 카탈로그.
 *
 * <p><strong>숫자 변환 규칙:</strong></p>
 * <ul>
 *   <li>{@link #DOUBLE}, {@link #FLOAT}: double, int32, int64에서 변환</li>
 *   <li>{@link #INT32}: int32, 범위 안의 int64, 반올림(half-even)한 double에서 변환</li>
 *   <li>{@link #INT64}: int64, int32, 반올림(half-even)한 double에서 변환</li>
 *   <li>{@link #INTEGER}: int32/int64/double에서 변환. int32에 맞으면 int32, int64에 맞으면
 *       int64로 저장하고, 그보다 크면 저장할 수 없음</li>
 * </ul>
 *
 * <p><strong>문자열:</strong> {@link #STRING}은 BSON string과 symbol 모두에서 변환됩니다.</p>
 *
 * <p><strong>바이너리:</strong> {@link #BINARY}, {@link #FUNCTION}, {@link #MD5},
 * {@link #USER_DEFINED}는 BSON binary subtype으로 구분됩니다. 저장 시 {@link Binary}의
 * type 값은 해당 subtype으로 대체됩니다.</p>
 *
 * <p><strong>시각:</strong> {@link #DATE_TIME}은 BSON datetime(epoch 밀리초)으로 저장하므로
 * 밀리초 미만은 버려집니다. 왕복 법칙은 밀리초 단위 {@link Instant}에 대해서만 성립합니다.</p>
 *
 * @author LBSON Team
 * @since 1.0.0
 */
public final class Primitives {

    private static final double INT64_MIN = -0x1p63;
    private static final double INT64_MAX = 0x1p63;
    private static final BigInteger BIG_INT32_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger BIG_INT32_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger BIG_INT64_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger BIG_INT64_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    /** 64-bit 부동소수점. */
    public static final Primitive<Double> DOUBLE = primitive("Double",
        BsonDouble::new,
        bson -> asDouble(bson));

    /** 32-bit 부동소수점 (double로 저장). */
    public static final Primitive<Float> FLOAT = primitive("Float",
        f -> new BsonDouble(f.doubleValue()),
        bson -> asDouble(bson).map(Double::floatValue));

    /** 32-bit 정수. */
    public static final Primitive<Integer> INT32 = primitive("Integer",
        BsonInt32::new,
        Primitives::asInt32);

    /** 64-bit 정수. */
    public static final Primitive<Long> INT64 = primitive("Long",
        BsonInt64::new,
        Primitives::asInt64);

    /** 임의 정밀도 정수 (int64 범위까지 저장 가능). */
    public static final Primitive<BigInteger> INTEGER = primitive("BigInteger",
        Primitives::bigIntegerToBson,
        bson -> asInt64(bson).map(BigInteger::valueOf));

    /** UTF-8 문자열. */
    public static final Primitive<String> STRING = primitive("String",
        BsonString::new,
        bson -> {
            if (bson.isString()) {
                return Optional.of(bson.asString().getValue());
            }
            if (bson.isSymbol()) {
                return Optional.of(bson.asSymbol().getSymbol());
            }
            return Optional.empty();
        });

    /** Boolean. */
    public static final Primitive<Boolean> BOOLEAN = primitive("Boolean",
        BsonBoolean::valueOf,
        bson -> bson.isBoolean() ? Optional.of(bson.asBoolean().getValue()) : Optional.empty());

    /** 중첩 plain 문서. */
    public static final Primitive<BsonDocument> DOCUMENT = primitive("BsonDocument",
        document -> document,
        bson -> bson.isDocument() ? Optional.of(bson.asDocument()) : Optional.empty());

    /** ObjectId. */
    public static final Primitive<ObjectId> OBJECT_ID = primitive("ObjectId",
        BsonObjectId::new,
        bson -> bson.isObjectId() ? Optional.of(bson.asObjectId().getValue()) : Optional.empty());

    /** UTC 시각 (밀리초 정밀도, 밀리초 미만은 저장 시 버림). */
    public static final Primitive<Instant> DATE_TIME = primitive("Instant",
        instant -> new BsonDateTime(instant.toEpochMilli()),
        bson -> bson.isDateTime()
            ? Optional.of(Instant.ofEpochMilli(bson.asDateTime().getValue()))
            : Optional.empty());

    /** 일반 바이너리 (subtype 0x00). */
    public static final Primitive<Binary> BINARY = binary("Binary", BsonBinarySubType.BINARY);

    /** 함수 바이너리 (subtype 0x01). */
    public static final Primitive<Binary> FUNCTION = binary("Function", BsonBinarySubType.FUNCTION);

    /** MD5 바이너리 (subtype 0x05). */
    public static final Primitive<Binary> MD5 = binary("MD5", BsonBinarySubType.MD5);

    /** 사용자 정의 바이너리 (subtype 0x80). */
    public static final Primitive<Binary> USER_DEFINED = binary("UserDefined", BsonBinarySubType.USER_DEFINED);

    /** UUID (표준 subtype 0x04). */
    public static final Primitive<UUID> UUID_VALUE = primitive("UUID",
        BsonBinary::new,
        bson -> bson.isBinary() && bson.asBinary().getType() == BsonBinarySubType.UUID_STANDARD.getValue()
            ? Optional.of(bson.asBinary().asUuid())
            : Optional.empty());

    /** 정규식. */
    public static final Primitive<BsonRegularExpression> REGEX = primitive("Regex",
        regex -> regex,
        bson -> bson.isRegularExpression() ? Optional.of(bson.asRegularExpression()) : Optional.empty());

    /** JavaScript 코드 (scope 없음). */
    public static final Primitive<Code> JAVASCRIPT = primitive("Javascript",
        code -> new BsonJavaScript(code.getCode()),
        bson -> bson.isJavaScript() ? Optional.of(new Code(bson.asJavaScript().getCode())) : Optional.empty());

    /** 심볼. */
    public static final Primitive<Symbol> SYMBOL = primitive("Symbol",
        symbol -> new BsonSymbol(symbol.getSymbol()),
        bson -> bson.isSymbol() ? Optional.of(new Symbol(bson.asSymbol().getSymbol())) : Optional.empty());

    /** MongoDB 내부 타임스탬프. */
    public static final Primitive<BsonTimestamp> MONGO_STAMP = primitive("MongoStamp",
        stamp -> stamp,
        bson -> bson.isTimestamp() ? Optional.of(bson.asTimestamp()) : Optional.empty());

    /** MinKey / MaxKey. */
    public static final Primitive<MinMaxKey> MIN_MAX_KEY = primitive("MinMaxKey",
        key -> key == MinMaxKey.MIN_KEY ? new BsonMinKey() : new BsonMaxKey(),
        bson -> {
            if (bson.getBsonType() == BsonType.MIN_KEY) {
                return Optional.of(MinMaxKey.MIN_KEY);
            }
            if (bson.getBsonType() == BsonType.MAX_KEY) {
                return Optional.of(MinMaxKey.MAX_KEY);
            }
            return Optional.empty();
        });

    /** BSON 값 그대로. */
    public static final Primitive<BsonValue> BSON_VALUE = primitive("BsonValue",
        bson -> bson,
        Optional::of);

    private static final Map<Class<?>, Primitive<?>> BY_CLASS = byClass();

    // Utility class - prevent instantiation
    private Primitives() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 원소 타입의 BSON 배열 브리지 생성.
     *
     * <p>배열의 모든 원소가 변환될 때만 성공합니다.</p>
     *
     * @param element 원소 브리지
     * @param <A> 원소 타입
     * @return {@code List<A>} 브리지
     * @throws IllegalArgumentException element가 null인 경우
     */
    public static <A> Primitive<List<A>> listOf(Primitive<A> element) {
        if (element == null) {
            throw new IllegalArgumentException("element cannot be null");
        }
        return primitive("List<" + element.typeName() + ">",
            list -> {
                BsonArray array = new BsonArray();
                for (A item : list) {
                    array.add(element.toBson(item));
                }
                return array;
            },
            bson -> {
                if (!bson.isArray()) {
                    return Optional.empty();
                }
                List<A> items = new ArrayList<>();
                for (BsonValue item : bson.asArray()) {
                    Optional<A> cast = element.fromBson(item);
                    if (cast.isEmpty()) {
                        return Optional.empty();
                    }
                    items.add(cast.get());
                }
                return Optional.of(Collections.unmodifiableList(items));
            });
    }

    /**
     * BSON null을 {@link Optional#empty()}로 대응하는 브리지 생성.
     *
     * @param element 값 브리지
     * @param <A> 값 타입
     * @return {@code Optional<A>} 브리지
     * @throws IllegalArgumentException element가 null인 경우
     */
    public static <A> Primitive<Optional<A>> optionalOf(Primitive<A> element) {
        if (element == null) {
            throw new IllegalArgumentException("element cannot be null");
        }
        return primitive("Optional<" + element.typeName() + ">",
            optional -> optional.map(element::toBson).orElse(BsonNull.VALUE),
            bson -> {
                if (bson.isNull()) {
                    return Optional.of(Optional.<A>empty());
                }
                return element.fromBson(bson).map(Optional::of);
            });
    }

    /**
     * 호스트 클래스의 기본 브리지 조회.
     *
     * <p>같은 클래스를 쓰는 여러 브리지 중에서는 일반적인 쪽이 선택됩니다
     * ({@link Binary} → {@link #BINARY}).</p>
     *
     * @param type 호스트 클래스
     * @param <T> 호스트 타입
     * @return 브리지, 없으면 empty
     */
    @SuppressWarnings("unchecked")
    public static <T> Optional<Primitive<T>> forClass(Class<T> type) {
        return Optional.ofNullable((Primitive<T>) BY_CLASS.get(type));
    }

    private static Map<Class<?>, Primitive<?>> byClass() {
        Map<Class<?>, Primitive<?>> map = new LinkedHashMap<>();
        map.put(Double.class, DOUBLE);
        map.put(Float.class, FLOAT);
        map.put(Integer.class, INT32);
        map.put(Long.class, INT64);
        map.put(BigInteger.class, INTEGER);
        map.put(String.class, STRING);
        map.put(Boolean.class, BOOLEAN);
        map.put(BsonDocument.class, DOCUMENT);
        map.put(ObjectId.class, OBJECT_ID);
        map.put(Instant.class, DATE_TIME);
        map.put(Binary.class, BINARY);
        map.put(UUID.class, UUID_VALUE);
        map.put(BsonRegularExpression.class, REGEX);
        map.put(Code.class, JAVASCRIPT);
        map.put(Symbol.class, SYMBOL);
        map.put(BsonTimestamp.class, MONGO_STAMP);
        map.put(MinMaxKey.class, MIN_MAX_KEY);
        return Collections.unmodifiableMap(map);
    }

    private static Primitive<Binary> binary(String typeName, BsonBinarySubType subType) {
        return primitive(typeName,
            binary -> new BsonBinary(subType, binary.getData()),
            bson -> bson.isBinary() && bson.asBinary().getType() == subType.getValue()
                ? Optional.of(new Binary(subType, bson.asBinary().getData()))
                : Optional.empty());
    }

    private static Optional<Double> asDouble(BsonValue bson) {
        if (bson.isDouble()) {
            return Optional.of(bson.asDouble().getValue());
        }
        if (bson.isInt32()) {
            return Optional.of((double) bson.asInt32().getValue());
        }
        if (bson.isInt64()) {
            return Optional.of((double) bson.asInt64().getValue());
        }
        return Optional.empty();
    }

    private static Optional<Integer> asInt32(BsonValue bson) {
        return asInt64(bson)
            .filter(n -> n >= Integer.MIN_VALUE && n <= Integer.MAX_VALUE)
            .map(Long::intValue);
    }

    private static Optional<Long> asInt64(BsonValue bson) {
        if (bson.isInt64()) {
            return Optional.of(bson.asInt64().getValue());
        }
        if (bson.isInt32()) {
            return Optional.of((long) bson.asInt32().getValue());
        }
        if (bson.isDouble()) {
            double rounded = Math.rint(bson.asDouble().getValue());
            if (Double.isNaN(rounded) || rounded < INT64_MIN || rounded >= INT64_MAX) {
                return Optional.empty();
            }
            return Optional.of((long) rounded);
        }
        return Optional.empty();
    }

    private static BsonValue bigIntegerToBson(BigInteger n) {
        if (n.compareTo(BIG_INT32_MIN) >= 0 && n.compareTo(BIG_INT32_MAX) <= 0) {
            return new BsonInt32(n.intValue());
        }
        if (n.compareTo(BIG_INT64_MIN) >= 0 && n.compareTo(BIG_INT64_MAX) <= 0) {
            return new BsonInt64(n.longValue());
        }
        throw new IllegalArgumentException("BigInteger out of int64 range: " + n);
    }

    private static <T> Primitive<T> primitive(String typeName,
                                              Function<T, BsonValue> toBson,
                                              Function<BsonValue, Optional<T>> fromBson) {
        return new Primitive<>() {
            @Override
            public BsonValue toBson(T value) {
                if (value == null) {
                    throw new IllegalArgumentException(typeName + " value cannot be null");
                }
                return toBson.apply(value);
            }

            @Override
            public Optional<T> fromBson(BsonValue bson) {
                return bson == null ? Optional.empty() : fromBson.apply(bson);
            }

            @Override
            public String typeName() {
                return typeName;
            }

            @Override
            public String toString() {
                return "Primitive{" + typeName + '}';
            }
        };
    }
}
