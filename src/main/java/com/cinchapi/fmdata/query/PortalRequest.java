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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.ValidationException;
import com.google.common.base.MoreObjects;

/**
 * Which rows of a portal to fetch along with each parent record: up to
 * {@link #limit()} rows starting at the 0-based {@link #offset()}, requested
 * {@link #chunkSize()} rows at a time.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class PortalRequest {

    /**
     * The number of portal rows requested per page unless configured
     * otherwise.
     */
    public static final int DEFAULT_CHUNK_SIZE = 100;

    /**
     * Return a {@link PortalRequest} for every row of the portal.
     *
     * @param name the portal object name
     * @return the request
     */
    public static PortalRequest of(String name) {
        return new PortalRequest(name, 0, null, DEFAULT_CHUNK_SIZE);
    }

    /**
     * Return a {@link PortalRequest}.
     *
     * @param name the portal object name
     * @param offset the 0-based offset of the first row
     * @param limit the maximum number of rows or {@code null} for all
     * @return the request
     * @throws ValidationException if {@code offset} is negative or
     *             {@code limit} is not positive
     */
    public static PortalRequest of(String name, int offset,
            @Nullable Integer limit) {
        return new PortalRequest(name, offset, limit, DEFAULT_CHUNK_SIZE);
    }

    private final String name;
    private final int offset;

    @Nullable
    private final Integer limit;

    private final int chunkSize;

    private PortalRequest(String name, int offset, @Nullable Integer limit,
            int chunkSize) {
        if(offset < 0) {
            throw ValidationException.format(
                    "Portal {} offset cannot be negative", name);
        }
        else if(limit != null && limit <= 0) {
            throw ValidationException
                    .format("Portal {} limit must be positive", name);
        }
        else if(chunkSize <= 0) {
            throw ValidationException
                    .format("Portal {} chunk size must be positive", name);
        }
        this.name = name;
        this.offset = offset;
        this.limit = limit;
        this.chunkSize = chunkSize;
    }

    public int chunkSize() {
        return chunkSize;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof PortalRequest) {
            PortalRequest other = (PortalRequest) obj;
            return name.equals(other.name) && offset == other.offset
                    && Objects.equals(limit, other.limit)
                    && chunkSize == other.chunkSize;
        }
        else {
            return false;
        }
    }

    /**
     * Return the number of rows to request with the parent record, which is
     * the first page of this portal.
     *
     * @return the first page limit
     */
    public int firstPageLimit() {
        return limit == null ? chunkSize : Math.min(chunkSize, limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, offset, limit, chunkSize);
    }

    @Nullable
    public Integer limit() {
        return limit;
    }

    public String name() {
        return name;
    }

    public int offset() {
        return offset;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", name)
                .add("offset", offset).add("limit", limit)
                .add("chunkSize", chunkSize).toString();
    }

    /**
     * Return a copy of this request that fetches {@code chunkSize} rows per
     * page.
     *
     * @param chunkSize
     * @return the request
     */
    public PortalRequest withChunkSize(int chunkSize) {
        return new PortalRequest(name, offset, limit, chunkSize);
    }

}
