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

import java.util.Map;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Maps;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * One raw portal row. Its values are keyed by {@code table::field}, where
 * {@code table} is the table occurrence the portal shows.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class PortalRowData {

    private final JsonObject raw;

    /**
     * Construct a new instance.
     *
     * @param raw
     */
    public PortalRowData(JsonObject raw) {
        this.raw = raw;
    }

    /**
     * Return the row's values keyed by {@code table::field}, without the
     * {@code recordId} and {@code modId} entries.
     *
     * @return the values
     */
    public Map<String, Object> values() {
        Map<String, Object> values = Maps.newLinkedHashMap();
        for (Map.Entry<String, JsonElement> entry : raw.entrySet()) {
            String key = entry.getKey();
            if(!key.equals("recordId") && !key.equals("modId")) {
                values.put(key, JsonValues.toJava(entry.getValue()));
            }
        }
        return values;
    }

    /**
     * Return the modification id of the related record.
     *
     * @return the mod id
     */
    public String modId() {
        return JsonValues.getString(raw, "modId");
    }

    /**
     * Return the id of the related record.
     *
     * @return the record id
     */
    public String recordId() {
        return JsonValues.getString(raw, "recordId");
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("recordId", recordId())
                .add("modId", modId()).toString();
    }

}
