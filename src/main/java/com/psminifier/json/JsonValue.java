package com.psminifier.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;

public sealed interface JsonValue {
    record JsonObject(MutableMap<String, JsonValue> fields) implements JsonValue {
        public JsonValue get(String key) {
            JsonValue value = fields.get(key);
            return value != null ? value : new JsonNull();
        }

        public boolean has(String key) {
            return !(get(key) instanceof JsonNull);
        }

        public String string(String key) {
            return get(key) instanceof JsonString s ? s.value() : null;
        }

        public boolean bool(String key) {
            return get(key) instanceof JsonBoolean b && b.value();
        }

        public int integer(String key, int fallback) {
            return get(key) instanceof JsonNumber n ? n.numberValue().intValue() : fallback;
        }

        public JsonObject object(String key) {
            return get(key) instanceof JsonObject o ? o : null;
        }

        /**
         * Returns the array under {@code key}, or an empty list when the key is absent or null.
         */
        public MutableList<JsonValue> array(String key) {
            return get(key) instanceof JsonArray a ? a.elements() : Lists.mutable.empty();
        }
    }

    record JsonArray(MutableList<JsonValue> elements) implements JsonValue {}

    record JsonString(String value) implements JsonValue {}

    sealed interface JsonNumber extends JsonValue {
        Number numberValue();

        record JsonLong(long value) implements JsonNumber {
            @Override
            public Number numberValue() {
                return value;
            }
        }

        record JsonDouble(double value) implements JsonNumber {
            @Override
            public Number numberValue() {
                return value;
            }
        }

        static JsonNumber of(long value) {
            return new JsonLong(value);
        }

        static JsonNumber of(double value) {
            return new JsonDouble(value);
        }
    }

    record JsonBoolean(boolean value) implements JsonValue {}
    record JsonNull() implements JsonValue {}
}
