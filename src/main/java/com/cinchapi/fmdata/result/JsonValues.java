/*
 * Copyright (c) 2013-2025 Cinchapi Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.cinchapi.fmdata.result;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Conversions between Gson's tree model and plain Java values.
 *
 * @author Jeff Nelson
 */
public final class JsonValues {

    /**
     * Convert the {@code element} to a plain Java value: a {@link String}, a
     * {@link java.math.BigDecimal}, a {@link Boolean}, a {@link List}, a
     * {@link Map} or {@code null}.
     *
     * @param element
     * @return the Java value
     */
    @Nullable
    public static Object toJava(@Nullable JsonElement element) {
        if(element == null || element.isJsonNull()) {
            return null;
        }
        else if(element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if(primitive.isNumber()) {
                return primitive.getAsBigDecimal();
            }
            else if(primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            else {
                return primitive.getAsString();
            }
        }
        else if(element.isJsonArray()) {
            List<Object> list = Lists.newArrayList();
            for (JsonElement item : element.getAsJsonArray()) {
                list.add(toJava(item));
            }
            return list;
        }
        else {
            Map<String, Object> map = Maps.newLinkedHashMap();
            for (Map.Entry<String, JsonElement> entry : element
                    .getAsJsonObject().entrySet()) {
                map.put(entry.getKey(), toJava(entry.getValue()));
            }
            return map;
        }
    }

    /**
     * Convert the {@code value} to a {@link JsonElement}.
     *
     * @param value
     * @return the json element
     */
    public static JsonElement toJson(@Nullable Object value) {
        if(value == null) {
            return JsonNull.INSTANCE;
        }
        else if(value instanceof JsonElement) {
            return (JsonElement) value;
        }
        else if(value instanceof Number) {
            return new JsonPrimitive((Number) value);
        }
        else if(value instanceof Boolean) {
            return new JsonPrimitive((Boolean) value);
        }
        else if(value instanceof Map) {
            JsonObject object = new JsonObject();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                object.add(String.valueOf(entry.getKey()),
                        toJson(entry.getValue()));
            }
            return object;
        }
        else if(value instanceof Iterable) {
            JsonArray array = new JsonArray();
            for (Object item : (Iterable<?>) value) {
                array.add(toJson(item));
            }
            return array;
        }
        else {
            return new JsonPrimitive(value.toString());
        }
    }

    /**
     * Return the string member {@code key} of {@code object} or {@code null}
     * if it is absent.
     *
     * @param object
     * @param key
     * @return the string value
     */
    @Nullable
    public static String getString(JsonObject object, String key) {
        JsonElement element = object.get(key);
        return element == null || element.isJsonNull() ? null
                : element.getAsString();
    }

    /**
     * Return the integer member {@code key} of {@code object} or {@code null}
     * if it is absent. The Data API reports some counts as strings, so those
     * are parsed.
     *
     * @param object
     * @param key
     * @return the integer value
     */
    @Nullable
    public static Integer getInteger(JsonObject object, String key) {
        String value = getString(object, key);
        return value == null ? null : Integer.parseInt(value.trim());
    }

    private JsonValues() {/* no-init */}

}
