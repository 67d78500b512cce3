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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cinchapi.fmdata.ErrorCode;
import com.cinchapi.fmdata.FileMakerClient;
import com.cinchapi.fmdata.ValidationException;
import com.cinchapi.fmdata.cache.LazyResultCache;
import com.cinchapi.fmdata.model.FieldDefinition;
import com.cinchapi.fmdata.model.Model;
import com.cinchapi.fmdata.model.RecordHandle;
import com.cinchapi.fmdata.paginate.Page;
import com.cinchapi.fmdata.paginate.PageRequest;
import com.cinchapi.fmdata.paginate.Paginator;
import com.cinchapi.fmdata.portal.PortalPrefetchCoordinator;
import com.cinchapi.fmdata.query.SortKey.Direction;
import com.cinchapi.fmdata.result.RecordData;
import com.cinchapi.fmdata.result.RecordsResult;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * A chainable, immutable query over the records of a {@link Model}.
 * <p>
 * Every shaping method returns a new {@link QueryBuilder} and leaves this
 * one untouched, so variants can branch from a common base. Field names and
 * lookups are resolved against the model's {@link Model#fields() catalog}
 * when the method is called, so mistakes fail before any request is sent.
 * </p>
 * <p>
 * Nothing is fetched until the results are read. Reading a builder executes
 * its query once, through a {@link Paginator}, into a {@link LazyResultCache}
 * that later reads of the same builder share. The pages of one execution
 * never yield the same record twice.
 * </p>
 * <p>
 * {@link #find(String, Object)} and {@link #omit(String, Object)} accept {@code field__suffix} lookups, where the
 * suffix is one of {@code exact}, {@code startswith}, {@code endswith},
 * {@code contains}, {@code gt}, {@code gte}, {@code lt}, {@code lte},
 * {@code range} or {@code raw}. A bare field name is an exact match. A
 * {@link Criterion} value is used as given.
 * </p>
 *
 * @author Jeff Nelson
 */
@NotThreadSafe
public final class QueryBuilder implements Iterable<RecordHandle> {

    private static final Logger log = LoggerFactory
            .getLogger(QueryBuilder.class);

    private final FileMakerClient client;
    private final Model model;
    private final QuerySpec spec;

    /**
     * The results of executing this query, once read.
     */
    @Nullable
    private LazyResultCache<RecordHandle> results = null;

    /**
     * Construct a new instance.
     *
     * @param client
     * @param model
     */
    public QueryBuilder(FileMakerClient client, Model model) {
        this(client, model, QuerySpec.create());
    }

    private QueryBuilder(FileMakerClient client, Model model,
            QuerySpec spec) {
        this.client = client;
        this.model = model;
        this.spec = spec;
    }

    /**
     * Return a copy that runs the {@code script} after each page request.
     *
     * @param name
     * @param param
     * @return the query
     */
    public QueryBuilder afterScript(String name, @Nullable String param) {
        return with(spec.withScripts(
                spec.scripts().withAfter(ScriptRequest.of(name, param))));
    }

    /**
     * Return a copy that requests {@code chunkSize} records per page.
     *
     * @param chunkSize
     * @return the query
     */
    public QueryBuilder chunkSize(int chunkSize) {
        return with(spec.withChunkSize(chunkSize));
    }

    /**
     * Delete every record of the result.
     *
     * @return the number of deleted records
     */
    public int delete() {
        List<RecordHandle> records = toList();
        for (RecordHandle record : records) {
            record.delete();
        }
        return records.size();
    }

    /**
     * Return a copy that also finds the records meeting every one of the
     * {@code lookups}.
     *
     * @param lookups lookup to value
     * @return the query
     */
    public QueryBuilder find(Map<String, Object> lookups) {
        return with(spec.withClause(SearchClause.find(resolve(lookups))));
    }

    /**
     * Return a copy that also finds the records meeting the {@code lookup}.
     *
     * @param lookup
     * @param value
     * @return the query
     */
    public QueryBuilder find(String lookup, Object value) {
        return find(Collections.singletonMap(lookup, value));
    }

    /**
     * Return the first record of the result or {@code null} if there is
     * none. If the result was not read yet, only the first record is
     * requested.
     *
     * @return the record
     */
    @Nullable
    public RecordHandle first() {
        if(results != null) {
            return results.isEmpty() ? null : results.get(0);
        }
        else {
            LazyResultCache<RecordHandle> head = slice(0, 1).results();
            return head.isEmpty() ? null : head.get(0);
        }
    }

    /**
     * Return the record at {@code index}. A negative {@code index} counts
     * from the end and reads the whole result. If the result was not read
     * yet, a non-negative {@code index} only requests that record.
     *
     * @param index
     * @return the record
     * @throws IndexOutOfBoundsException
     */
    public RecordHandle get(int index) {
        if(results != null || index < 0 || index == Integer.MAX_VALUE) {
            return results().get(index);
        }
        else {
            LazyResultCache<RecordHandle> single = slice(index, index + 1)
                    .results();
            if(single.isEmpty()) {
                throw new IndexOutOfBoundsException(
                        "No record at index " + index);
            }
            return single.get(0);
        }
    }

    /**
     * Return {@code true} if the result is empty. At most one record is read.
     *
     * @return a boolean
     */
    public boolean isEmpty() {
        return results().isEmpty();
    }

    @Override
    public Iterator<RecordHandle> iterator() {
        return results().iterator();
    }

    /**
     * Return a copy that omits the records meeting every one of the
     * {@code lookups}.
     *
     * @param lookups lookup to value
     * @return the query
     */
    public QueryBuilder omit(Map<String, Object> lookups) {
        return with(spec.withClause(SearchClause.omit(resolve(lookups))));
    }

    /**
     * Return a copy that omits the records meeting the {@code lookup}.
     *
     * @param lookup
     * @param value
     * @return the query
     */
    public QueryBuilder omit(String lookup, Object value) {
        return omit(Collections.singletonMap(lookup, value));
    }

    /**
     * Return a copy sorted by the {@code fields}, in order, after any fields
     * of earlier calls. A field prefixed with {@code -} is sorted in
     * descending order.
     *
     * @param fields
     * @return the query
     */
    public QueryBuilder orderBy(String... fields) {
        ImmutableList.Builder<SortKey> keys = ImmutableList.builder();
        for (String field : fields) {
            Direction direction = Direction.ASCEND;
            String name = field;
            if(field.startsWith("-")) {
                direction = Direction.DESCEND;
                name = field.substring(1);
            }
            keys.add(SortKey.of(model.fields().resolve(name).remoteName(),
                    direction));
        }
        return with(spec.withSortKeys(keys.build()));
    }

    /**
     * Return a copy that prefetches every row of the portal {@code name}.
     *
     * @param name
     * @return the query
     */
    public QueryBuilder prefetch(String name) {
        model.portal(name);
        return with(spec.withPortal(PortalRequest.of(name)));
    }

    /**
     * Return a copy that prefetches up to {@code limit} rows of the portal
     * {@code name}, starting at the 0-based {@code offset}.
     *
     * @param name
     * @param offset
     * @param limit the maximum number of rows or {@code null} for all
     * @return the query
     */
    public QueryBuilder prefetch(String name, int offset,
            @Nullable Integer limit) {
        model.portal(name);
        return with(spec.withPortal(PortalRequest.of(name, offset, limit)));
    }

    /**
     * Return a copy that prefetches the portal as the {@code request}
     * describes.
     *
     * @param request
     * @return the query
     */
    public QueryBuilder prefetch(PortalRequest request) {
        model.portal(request.name());
        return with(spec.withPortal(request));
    }

    /**
     * Return a copy that runs the {@code script} before each page request.
     *
     * @param name
     * @param param
     * @return the query
     */
    public QueryBuilder preRequestScript(String name,
            @Nullable String param) {
        return with(spec.withScripts(
                spec.scripts().withPreRequest(ScriptRequest.of(name, param))));
    }

    /**
     * Return a copy that runs the {@code script} before the found set of
     * each page request is sorted.
     *
     * @param name
     * @param param
     * @return the query
     */
    public QueryBuilder preSortScript(String name, @Nullable String param) {
        return with(spec.withScripts(
                spec.scripts().withPreSort(ScriptRequest.of(name, param))));
    }

    /**
     * Return a copy whose records are returned through {@code layout}.
     *
     * @param layout
     * @return the query
     */
    public QueryBuilder responseLayout(String layout) {
        return with(spec.withResponseLayout(layout));
    }

    /**
     * Return the results of this query, executing it on the first call.
     *
     * @return the results
     */
    public LazyResultCache<RecordHandle> results() {
        if(results == null) {
            results = execute();
        }
        return results;
    }

    /**
     * Return the number of records in the result, reading all of them.
     *
     * @return the size
     */
    public int size() {
        return results().size();
    }

    /**
     * Return a copy restricted to the records in {@code [start, stop)} of
     * this query's current window. Slices compose: a sliced query can be
     * sliced again, but can no longer be shaped otherwise.
     *
     * @param start
     * @param stop the exclusive end or {@code null} for no end
     * @return the query
     * @throws ValidationException if a bound is negative or {@code stop} is
     *             not greater than {@code start}
     */
    public QueryBuilder slice(int start, @Nullable Integer stop) {
        return with(spec.withSlice(start, stop));
    }

    public QuerySpec spec() {
        return spec;
    }

    /**
     * Return a sequential stream of the result.
     *
     * @return the stream
     */
    public Stream<RecordHandle> stream() {
        return results().stream();
    }

    /**
     * Return every record of the result.
     *
     * @return the records
     */
    public List<RecordHandle> toList() {
        return results().toList();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("layout", model.layout())
                .add("spec", spec).toString();
    }

    /**
     * Set the {@code values} on every record of the result and save each.
     *
     * @param values declared field name to value
     * @param checkModId whether each edit checks the record's mod id
     * @return the number of updated records
     */
    public int update(Map<String, Object> values, boolean checkModId) {
        List<RecordHandle> records = toList();
        for (RecordHandle record : records) {
            values.forEach(record::set);
            record.save(checkModId);
        }
        return records.size();
    }

    /**
     * Start a new execution of this query.
     *
     * @return the results
     */
    private LazyResultCache<RecordHandle> execute() {
        log.debug("Executing query on layout {}: {}", model.layout(), spec);
        PortalPrefetchCoordinator portals = new PortalPrefetchCoordinator(
                client, model, spec.portals());
        return new LazyResultCache<>(new Paginator<>(spec.window(),
                spec.chunkSize(), request -> fetch(request, portals),
                RecordHandle::recordId));
    }

    /**
     * Request one page of records.
     *
     * @param request
     * @param portals
     * @return the page
     */
    private Page<RecordHandle> fetch(PageRequest request,
            PortalPrefetchCoordinator portals) {
        int offset = request.offset() + 1;
        RecordsResult result = spec.clauses().isEmpty()
                ? client.getRecords(model.layout(), offset, request.limit(),
                        spec.sort(), portals.requests(), spec.scripts(),
                        spec.responseLayout())
                : client.find(model.layout(), spec.clauses(), spec.sort(),
                        offset, request.limit(), portals.requests(),
                        spec.scripts(), spec.responseLayout());
        if(result.hasError(ErrorCode.NO_RECORDS_MATCH)) {
            return Page.empty();
        }
        result.raiseIfError();
        ImmutableList.Builder<RecordHandle> records = ImmutableList.builder();
        for (RecordData data : result.data()) {
            records.add(new RecordHandle(client, model, data,
                    portals.attach(data)));
        }
        return Page.of(records.build());
    }

    /**
     * Resolve the {@code lookups} to encoded conditions on remote fields.
     *
     * @param lookups
     * @return remote field name to encoded criterion
     */
    private Map<String, String> resolve(Map<String, Object> lookups) {
        if(lookups.isEmpty()) {
            throw new ValidationException("A clause needs at least one lookup");
        }
        Map<String, String> conditions = Maps.newLinkedHashMap();
        lookups.forEach((key, value) -> {
            Lookup lookup = Lookup.parse(key);
            FieldDefinition field = model.fields().resolve(lookup.field());
            Criterion criterion;
            if(value instanceof Criterion) {
                if(!key.equals(lookup.field())) {
                    throw ValidationException.format(
                            "Lookup {} cannot carry a suffix when its value is "
                                    + "a Criterion",
                            key);
                }
                criterion = (Criterion) value;
            }
            else if(value == null) {
                throw ValidationException.format(
                        "Lookup {} has no value; use Criterion.empty() to "
                                + "match an empty field",
                        key);
            }
            else {
                criterion = Criterion.of(lookup.operator(), value);
            }
            conditions.put(field.remoteName(),
                    criterion.encode(model.codec(), field.type()));
        });
        return conditions;
    }

    /**
     * Return a {@link QueryBuilder} for {@code spec}.
     *
     * @param spec
     * @return the query
     */
    private QueryBuilder with(QuerySpec spec) {
        return new QueryBuilder(client, model, spec);
    }

}
