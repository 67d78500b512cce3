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
package com.cinchapi.fmdata.paginate;

import java.util.Objects;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;

/**
 * A request for at most {@link #limit()} records starting at the 0-based
 * {@link #offset()}.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class PageRequest {

    /**
     * Return a {@link PageRequest}.
     *
     * @param offset
     * @param limit
     * @return the request
     */
    public static PageRequest of(int offset, int limit) {
        return new PageRequest(offset, limit);
    }

    private final int offset;
    private final int limit;

    private PageRequest(int offset, int limit) {
        this.offset = offset;
        this.limit = limit;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof PageRequest) {
            return offset == ((PageRequest) obj).offset
                    && limit == ((PageRequest) obj).limit;
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, limit);
    }

    public int limit() {
        return limit;
    }

    public int offset() {
        return offset;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("offset", offset)
                .add("limit", limit).toString();
    }

}
