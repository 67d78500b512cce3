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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.gson.JsonObject;

/**
 * The {@code dataInfo} section of a record read.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class DataInfo {

    private final JsonObject raw;

    /**
     * Construct a new instance.
     *
     * @param raw
     */
    DataInfo(JsonObject raw) {
        this.raw = raw;
    }

    @Nullable
    public String database() {
        return JsonValues.getString(raw, "database");
    }

    @Nullable
    public String layout() {
        return JsonValues.getString(raw, "layout");
    }

    @Nullable
    public String table() {
        return JsonValues.getString(raw, "table");
    }

    /**
     * Return the number of records in the table.
     *
     * @return the total record count
     */
    @Nullable
    public Integer totalRecordCount() {
        return JsonValues.getInteger(raw, "totalRecordCount");
    }

    /**
     * Return the number of records in the found set.
     *
     * @return the found count
     */
    @Nullable
    public Integer foundCount() {
        return JsonValues.getInteger(raw, "foundCount");
    }

    /**
     * Return the number of records in this response.
     *
     * @return the returned count
     */
    @Nullable
    public Integer returnedCount() {
        return JsonValues.getInteger(raw, "returnedCount");
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("layout", layout())
                .add("foundCount", foundCount())
                .add("returnedCount", returnedCount()).toString();
    }

}
