package com.eventfunnel.analytics.pipeline;

import com.eventfunnel.analytics.util.JsonSupport;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSONEachRow builder for report output. Field order is insertion order.
 */
final class JsonRow {
    private final Map<String, Object> fields = new LinkedHashMap<>();

    static JsonRow create() {
        return new JsonRow();
    }

    JsonRow addString(String name, String value) {
        fields.put(name, value == null ? "" : value);
        return this;
    }

    JsonRow addNullableString(String name, String value) {
        fields.put(name, value);
        return this;
    }

    JsonRow addInt(String name, int value) {
        fields.put(name, value);
        return this;
    }

    JsonRow addLong(String name, long value) {
        fields.put(name, value);
        return this;
    }

    JsonRow addNullableDouble(String name, Double value) {
        fields.put(name, value);
        return this;
    }

    String build() {
        return JsonSupport.toJson(fields);
    }
}
