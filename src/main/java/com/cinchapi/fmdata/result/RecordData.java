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

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * One raw record from a record read: its id, mod id, field values keyed by
 * remote field name and the rows of every portal that was returned with it.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class RecordData {

    private final JsonObject raw;

    /**
     * Construct a new instance.
     *
     * @param raw
     */
    public RecordData(JsonObject raw) {
        this.raw = raw;
    }

    /**
     * Return the field values keyed by remote field name. Values are plain
     * Java values as produced by {@link JsonValues#toJava(JsonElement)}.
     *
     * @return the field data
     */
    public Map<String, Object> fieldData() {
        JsonElement fields = raw.get("fieldData");
        if(fields == null || !fields.isJsonObject()) {
            return ImmutableMap.of();
        }
        else {
            Map<String, Object> data = Maps.newLinkedHashMap();
            for (Map.Entry<String, JsonElement> entry : fields
                    .getAsJsonObject().entrySet()) {
                data.put(entry.getKey(), JsonValues.toJava(entry.getValue()));
            }
            return data;
        }
    }

    /**
     * Return the modification id.
     *
     * @return the mod id
     */
    public String modId() {
        return JsonValues.getString(raw, "modId");
    }

    /**
     * Return the rows of every portal in this record keyed by portal name.
     *
     * @return the portal data
     */
    public Map<String, List<PortalRowData>> portalData() {
        JsonElement portals = raw.get("portalData");
        if(portals == null || !portals.isJsonObject()) {
            return ImmutableMap.of();
        }
        else {
            Map<String, List<PortalRowData>> data = Maps.newLinkedHashMap();
            for (Map.Entry<String, JsonElement> entry : portals
                    .getAsJsonObject().entrySet()) {
                ImmutableList.Builder<PortalRowData> rows = ImmutableList
                        .builder();
                for (JsonElement row : entry.getValue().getAsJsonArray()) {
                    rows.add(new PortalRowData(row.getAsJsonObject()));
                }
                data.put(entry.getKey(), rows.build());
            }
            return data;
        }
    }

    /**
     * Return {@code true} if the record came back with rows for
     * {@code portal}, even if there are none.
     *
     * @param portal
     * @return a boolean
     */
    public boolean hasPortal(String portal) {
        JsonElement portals = raw.get("portalData");
        return portals != null && portals.isJsonObject()
                && portals.getAsJsonObject().has(portal);
    }

    /**
     * Return the record id.
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
