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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * The result of a record read: a single record, a range of records or a find.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class RecordsResult extends ScriptResult {

    /**
     * Construct a new instance.
     *
     * @param raw
     */
    public RecordsResult(JsonObject raw) {
        super(raw);
    }

    /**
     * Return the records in this response, in the order the remote service
     * sent them. The list is empty if the response has no {@code data}
     * section (e.g. because the call failed).
     *
     * @return the records
     */
    public List<RecordData> data() {
        JsonElement data = response().get("data");
        if(data == null || !data.isJsonArray()) {
            return ImmutableList.of();
        }
        else {
            ImmutableList.Builder<RecordData> records = ImmutableList
                    .builder();
            for (JsonElement record : data.getAsJsonArray()) {
                records.add(new RecordData(record.getAsJsonObject()));
            }
            return records.build();
        }
    }

    /**
     * Return the {@code dataInfo} section, if present.
     *
     * @return the data info
     */
    @Nullable
    public DataInfo dataInfo() {
        JsonElement info = response().get("dataInfo");
        return info != null && info.isJsonObject()
                ? new DataInfo(info.getAsJsonObject())
                : null;
    }

}
