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

import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.ValidationException;
import com.cinchapi.fmdata.paginate.Window;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Everything that shapes a query: the find clauses, the sort, the window of
 * records, the page size, the portals to prefetch, the response layout and
 * the scripts.
 * <p>
 * A {@link QuerySpec} is immutable; every {@code with} method returns a new
 * instance. Slicing is the last shaping step: once a spec is sliced, further
 * slices narrow its window but every other change fails with a
 * {@link ValidationException}.
 * </p>
 *
 * @author Jeff Nelson
 */
@Immutable
public final class QuerySpec {

    /**
     * The number of records requested per page unless configured otherwise.
     */
    public static final int DEFAULT_CHUNK_SIZE = 1000;

    /**
     * An unshaped spec.
     */
    private static final QuerySpec EMPTY = new QuerySpec(ImmutableList.of(),
            ImmutableList.of(), Window.ALL, false, DEFAULT_CHUNK_SIZE,
            ImmutableMap.of(), null, Scripts.none());

    /**
     * Return a {@link QuerySpec} that covers every record in the layout's
     * default order.
     *
     * @return the spec
     */
    public static QuerySpec create() {
        return EMPTY;
    }

    private final List<SearchClause> clauses;
    private final List<SortKey> sort;
    private final Window window;
    private final boolean sliced;
    private final int chunkSize;
    private final Map<String, PortalRequest> portals;

    @Nullable
    private final String responseLayout;

    private final Scripts scripts;

    private QuerySpec(List<SearchClause> clauses, List<SortKey> sort,
            Window window, boolean sliced, int chunkSize,
            Map<String, PortalRequest> portals,
            @Nullable String responseLayout, Scripts scripts) {
        this.clauses = clauses;
        this.sort = sort;
        this.window = window;
        this.sliced = sliced;
        this.chunkSize = chunkSize;
        this.portals = portals;
        this.responseLayout = responseLayout;
        this.scripts = scripts;
    }

    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Return the find clauses. If there are none, the query lists the
     * layout's records instead of performing a find.
     *
     * @return the clauses
     */
    public List<SearchClause> clauses() {
        return clauses;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof QuerySpec) {
            QuerySpec other = (QuerySpec) obj;
            return clauses.equals(other.clauses) && sort.equals(other.sort)
                    && window.equals(other.window) && sliced == other.sliced
                    && chunkSize == other.chunkSize
                    && portals.equals(other.portals)
                    && Objects.equals(responseLayout, other.responseLayout)
                    && scripts.equals(other.scripts);
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(clauses, sort, window, sliced, chunkSize, portals,
                responseLayout, scripts);
    }

    /**
     * Return {@code true} if a slice was applied.
     *
     * @return a boolean
     */
    public boolean isSliced() {
        return sliced;
    }

    /**
     * Return the portals to prefetch, keyed by portal name, in the order they
     * were requested.
     *
     * @return the portal requests
     */
    public Map<String, PortalRequest> portals() {
        return portals;
    }

    @Nullable
    public String responseLayout() {
        return responseLayout;
    }

    public Scripts scripts() {
        return scripts;
    }

    public List<SortKey> sort() {
        return sort;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("clauses", clauses)
                .add("sort", sort).add("window", window)
                .add("chunkSize", chunkSize).add("portals", portals.keySet())
                .omitNullValues().add("responseLayout", responseLayout)
                .toString();
    }

    public Window window() {
        return window;
    }

    /**
     * Return a copy with {@code chunkSize} records per page.
     *
     * @param chunkSize
     * @return the spec
     */
    public QuerySpec withChunkSize(int chunkSize) {
        checkNotSliced("chunk size");
        if(chunkSize <= 0) {
            throw ValidationException.format(
                    "Chunk size must be positive, not {}", chunkSize);
        }
        return new QuerySpec(clauses, sort, window, sliced, chunkSize,
                portals, responseLayout, scripts);
    }

    /**
     * Return a copy with {@code clause} appended.
     *
     * @param clause
     * @return the spec
     */
    public QuerySpec withClause(SearchClause clause) {
        checkNotSliced("criteria");
        List<SearchClause> clauses = ImmutableList.<SearchClause> builder()
                .addAll(this.clauses).add(clause).build();
        return new QuerySpec(clauses, sort, window, sliced, chunkSize,
                portals, responseLayout, scripts);
    }

    /**
     * Return a copy that also prefetches the portal of {@code request}. A
     * previous request for the same portal is replaced.
     *
     * @param request
     * @return the spec
     */
    public QuerySpec withPortal(PortalRequest request) {
        checkNotSliced("prefetched portals");
        ImmutableMap.Builder<String, PortalRequest> portals = ImmutableMap
                .builder();
        this.portals.forEach((name, existing) -> {
            if(!name.equals(request.name())) {
                portals.put(name, existing);
            }
        });
        portals.put(request.name(), request);
        return new QuerySpec(clauses, sort, window, sliced, chunkSize,
                portals.build(), responseLayout, scripts);
    }

    /**
     * Return a copy whose records are returned through {@code layout}.
     *
     * @param layout
     * @return the spec
     */
    public QuerySpec withResponseLayout(String layout) {
        checkNotSliced("response layout");
        return new QuerySpec(clauses, sort, window, sliced, chunkSize,
                portals, layout, scripts);
    }

    /**
     * Return a copy that runs the {@code scripts}.
     *
     * @param scripts
     * @return the spec
     */
    public QuerySpec withScripts(Scripts scripts) {
        checkNotSliced("scripts");
        return new QuerySpec(clauses, sort, window, sliced, chunkSize,
                portals, responseLayout, scripts);
    }

    /**
     * Return a copy sliced to {@code [start, stop)}, relative to the current
     * window.
     *
     * @param start
     * @param stop
     * @return the spec
     * @see Window#compose(int, Integer)
     */
    public QuerySpec withSlice(int start, @Nullable Integer stop) {
        return new QuerySpec(clauses, sort, window.compose(start, stop), true,
                chunkSize, portals, responseLayout, scripts);
    }

    /**
     * Return a copy that also sorts by the {@code keys}, after the keys of
     * the current sort.
     *
     * @param keys
     * @return the spec
     */
    public QuerySpec withSortKeys(List<SortKey> keys) {
        checkNotSliced("sort");
        return new QuerySpec(clauses,
                ImmutableList.<SortKey> builder().addAll(sort).addAll(keys)
                        .build(),
                window, sliced, chunkSize, portals, responseLayout, scripts);
    }

    /**
     * Throw a {@link ValidationException} if this spec is sliced.
     *
     * @param what the aspect being changed
     */
    private void checkNotSliced(String what) {
        if(sliced) {
            throw ValidationException.format(
                    "Cannot change the {} of a query after it was sliced",
                    what);
        }
    }

}
