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

import java.util.Objects;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.gson.JsonObject;

/**
 * A remote field and the {@link Direction} to sort it in.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class SortKey {

    /**
     * Return a {@link SortKey}.
     *
     * @param field the remote field name
     * @param direction
     * @return the sort key
     */
    public static SortKey of(String field, Direction direction) {
        return new SortKey(field, direction);
    }

    private final String field;
    private final Direction direction;

    private SortKey(String field, Direction direction) {
        this.field = field;
        this.direction = direction;
    }

    public Direction direction() {
        return direction;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof SortKey) {
            return field.equals(((SortKey) obj).field)
                    && direction == ((SortKey) obj).direction;
        }
        else {
            return false;
        }
    }

    public String field() {
        return field;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, direction);
    }

    /**
     * Return the json form of this key.
     *
     * @return the json
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("fieldName", field);
        json.addProperty("sortOrder", direction.wire());
        return json;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("field", field)
                .add("direction", direction).toString();
    }

    /**
     * A sort direction.
     *
     * @author Jeff Nelson
     */
    public enum Direction {
        ASCEND("ascend"),
        DESCEND("descend");

        private final String wire;

        Direction(String wire) {
            this.wire = wire;
        }

        /**
         * Return the name of the direction in requests.
         *
         * @return the name
         */
        public String wire() {
            return wire;
        }
    }

}
