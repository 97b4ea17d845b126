package com.ryuqq.lbson.core.value;

import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

import java.util.stream.Collectors;

/**
 * plain BSON 값의 짧은 텍스트 표현.
 */
final class BsonFormat {

    private static final JsonWriterSettings JSON = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .build();

    private BsonFormat() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String render(BsonValue value) {
        switch (value.getBsonType()) {
            case STRING:
                return '"' + value.asString().getValue() + '"';
            case INT32:
                return String.valueOf(value.asInt32().getValue());
            case INT64:
                return String.valueOf(value.asInt64().getValue());
            case DOUBLE:
                return String.valueOf(value.asDouble().getValue());
            case BOOLEAN:
                return String.valueOf(value.asBoolean().getValue());
            case NULL:
                return "null";
            case OBJECT_ID:
                return "ObjectId(" + value.asObjectId().getValue().toHexString() + ")";
            case DOCUMENT:
                return value.asDocument().toJson(JSON);
            case ARRAY:
                return value.asArray().getValues().stream()
                    .map(BsonFormat::render)
                    .collect(Collectors.joining(", ", "[", "]"));
            default:
                return value.toString();
        }
    }
}
