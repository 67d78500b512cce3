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

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;

/**
 * One request of a find: the encoded conditions on remote fields, all of
 * which a record must meet, and whether matching records are found or
 * omitted. The clauses of a find are combined with a logical OR, in order.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class SearchClause {

    /**
     * Return a {@link SearchClause} that finds records meeting the
     * {@code conditions}.
     *
     * @param conditions remote field name to encoded criterion
     * @return the clause
     */
    public static SearchClause find(Map<String, String> conditions) {
        return new SearchClause(conditions, false);
    }

    /**
     * Return a {@link SearchClause} that omits records meeting the
     * {@code conditions}.
     *
     * @param conditions remote field name to encoded criterion
     * @return the clause
     */
    public static SearchClause omit(Map<String, String> conditions) {
        return new SearchClause(conditions, true);
    }

    private final Map<String, String> conditions;
    private final boolean omit;

    private SearchClause(Map<String, String> conditions, boolean omit) {
        this.conditions = ImmutableMap.copyOf(conditions);
        this.omit = omit;
    }

    public Map<String, String> conditions() {
        return conditions;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof SearchClause) {
            return omit == ((SearchClause) obj).omit
                    && conditions.equals(((SearchClause) obj).conditions);
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions, omit);
    }

    public boolean isOmit() {
        return omit;
    }

    /**
     * Return the json form of this clause for the {@code query} member of a
     * find request.
     *
     * @return the json
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        conditions.forEach(json::addProperty);
        json.addProperty("omit", omit ? "true" : "false");
        return json;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("conditions", conditions)
                .add("omit", omit).toString();
    }

}
