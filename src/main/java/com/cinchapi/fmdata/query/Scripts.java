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
package com.cinchapi.fmdata.query;

import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Maps;

/**
 * The scripts to run around a request: one before the request is processed,
 * one before the found set is sorted and one after.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class Scripts {

    /**
     * No scripts.
     */
    private static final Scripts NONE = new Scripts(null, null, null);

    /**
     * Return the {@link Scripts} that run nothing.
     *
     * @return the scripts
     */
    public static Scripts none() {
        return NONE;
    }

    @Nullable
    private final ScriptRequest preRequest;

    @Nullable
    private final ScriptRequest preSort;

    @Nullable
    private final ScriptRequest after;

    private Scripts(@Nullable ScriptRequest preRequest,
            @Nullable ScriptRequest preSort, @Nullable ScriptRequest after) {
        this.preRequest = preRequest;
        this.preSort = preSort;
        this.after = after;
    }

    @Nullable
    public ScriptRequest after() {
        return after;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof Scripts) {
            Scripts other = (Scripts) obj;
            return Objects.equals(preRequest, other.preRequest)
                    && Objects.equals(preSort, other.preSort)
                    && Objects.equals(after, other.after);
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(preRequest, preSort, after);
    }

    /**
     * Return {@code true} if no script is set.
     *
     * @return a boolean
     */
    public boolean isEmpty() {
        return preRequest == null && preSort == null && after == null;
    }

    @Nullable
    public ScriptRequest preRequest() {
        return preRequest;
    }

    @Nullable
    public ScriptRequest preSort() {
        return preSort;
    }

    /**
     * Return the request parameters that carry these scripts, which are the
     * same whether they go in a query string or a request body.
     *
     * @return the parameters, in a stable order
     */
    public Map<String, String> toParameters() {
        Map<String, String> params = Maps.newLinkedHashMap();
        put(params, "script.prerequest", preRequest);
        put(params, "script.presort", preSort);
        put(params, "script", after);
        return params;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("preRequest", preRequest).add("preSort", preSort)
                .add("after", after).toString();
    }

    /**
     * Return a copy that runs {@code script} after the request.
     *
     * @param script
     * @return the scripts
     */
    public Scripts withAfter(ScriptRequest script) {
        return new Scripts(preRequest, preSort, script);
    }

    /**
     * Return a copy that runs {@code script} before the request.
     *
     * @param script
     * @return the scripts
     */
    public Scripts withPreRequest(ScriptRequest script) {
        return new Scripts(script, preSort, after);
    }

    /**
     * Return a copy that runs {@code script} before the sort.
     *
     * @param script
     * @return the scripts
     */
    public Scripts withPreSort(ScriptRequest script) {
        return new Scripts(preRequest, script, after);
    }

    /**
     * Add the parameters of {@code script}, if set, under {@code key}.
     *
     * @param params
     * @param key
     * @param script
     */
    private static void put(Map<String, String> params, String key,
            @Nullable ScriptRequest script) {
        if(script != null) {
            params.put(key, script.name());
            if(script.param() != null) {
                params.put(key + ".param", script.param());
            }
        }
    }

}
