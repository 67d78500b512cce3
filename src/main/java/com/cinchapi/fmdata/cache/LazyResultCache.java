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
package com.cinchapi.fmdata.cache;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import com.cinchapi.common.base.AnyStrings;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Streams;

/**
 * A sequence backed by a single-pass {@link Iterator source} that looks fully
 * materialized to its readers.
 * <p>
 * Every element is pulled from the source at most once and only when some
 * read needs it. Pulled elements are cached, so index access, slicing and
 * repeated iteration never touch the source for an element that was already
 * seen. Reads that must know the size of the sequence (e.g. negative indexes,
 * {@link #size()} and {@link #toList()}) drain the source.
 * </p>
 * <p>
 * Each call to {@link #iterator()} returns a fresh cursor that replays the
 * cache and only falls back to the source past its high-water mark, so two
 * cursors never consume the same source element twice.
 * </p>
 * <p>
 * Instances are not thread-safe.
 * </p>
 *
 * @author Jeff Nelson
 */
@NotThreadSafe
public class LazyResultCache<T> implements Iterable<T> {

    /**
     * Return a {@link LazyResultCache} over the {@code values}.
     *
     * @param values
     * @return the cache
     */
    public static <T> LazyResultCache<T> of(Iterable<T> values) {
        return new LazyResultCache<>(values.iterator());
    }

    /**
     * The source of elements that are not yet cached.
     */
    private final Iterator<T> source;

    /**
     * The elements pulled from the {@link #source}, in order.
     */
    private final List<T> cache;

    /**
     * An unmodifiable view of the {@link #cache}.
     */
    private final List<T> view;

    /**
     * A flag that indicates the {@link #source} is exhausted.
     */
    private boolean complete = false;

    /**
     * Construct a new instance.
     *
     * @param source
     */
    public LazyResultCache(Iterator<T> source) {
        this.source = source;
        this.cache = Lists.newArrayList();
        this.view = Collections.unmodifiableList(cache);
    }

    /**
     * Return the number of elements pulled from the source so far.
     *
     * @return the cached count
     */
    public int cachedCount() {
        return cache.size();
    }

    /**
     * Return a snapshot of the elements pulled from the source so far.
     *
     * @return the cached values
     */
    public List<T> cachedValues() {
        return ImmutableList.copyOf(cache);
    }

    /**
     * Return the element at {@code index}. A negative {@code index} counts
     * from the end and drains the source.
     *
     * @param index
     * @return the element
     * @throws IndexOutOfBoundsException
     */
    public T get(int index) {
        if(index < 0) {
            drain();
            int resolved = cache.size() + index;
            if(resolved < 0) {
                throw new IndexOutOfBoundsException(AnyStrings.format(
                        "Index {} is out of range for {} elements", index,
                        cache.size()));
            }
            return cache.get(resolved);
        }
        else {
            fill(index + 1);
            if(index >= cache.size()) {
                throw new IndexOutOfBoundsException(AnyStrings.format(
                        "Index {} is out of range for {} elements", index,
                        cache.size()));
            }
            return cache.get(index);
        }
    }

    /**
     * Return {@code true} if the source is exhausted and every element is
     * cached.
     *
     * @return a boolean
     */
    public boolean isComplete() {
        return complete;
    }

    /**
     * Return {@code true} if the sequence has no elements. At most one
     * element is pulled to decide.
     *
     * @return a boolean
     */
    public boolean isEmpty() {
        fill(1);
        return cache.isEmpty();
    }

    @Override
    public Iterator<T> iterator() {
        return new AbstractIterator<T>() {

            private int position = 0;

            @Override
            protected T computeNext() {
                if(position < cache.size() || pull()) {
                    return cache.get(position++);
                }
                else {
                    return endOfData();
                }
            }

        };
    }

    /**
     * Return the number of elements, draining the source.
     *
     * @return the size
     */
    public int size() {
        drain();
        return cache.size();
    }

    /**
     * Return the elements in {@code [start, stop)}.
     *
     * @param start
     * @param stop
     * @return the elements
     * @see #slice(Integer, Integer, int)
     */
    public List<T> slice(@Nullable Integer start, @Nullable Integer stop) {
        return slice(start, stop, 1);
    }

    /**
     * Return every {@code step}th element in {@code [start, stop)}.
     * <p>
     * Bounds follow the usual slicing rules: {@code null} means the beginning
     * or the end, negative values count from the end and out of range values
     * are clamped. A {@code null} or negative bound drains the source;
     * otherwise exactly {@code stop} elements are pulled, at most.
     * </p>
     *
     * @param start
     * @param stop
     * @param step must be positive
     * @return the elements, materialized
     */
    public List<T> slice(@Nullable Integer start, @Nullable Integer stop,
            int step) {
        Preconditions.checkArgument(step > 0, "Slice step must be positive");
        if(stop == null || stop < 0 || (start != null && start < 0)) {
            drain();
        }
        else {
            fill(stop);
        }
        int size = cache.size();
        int from = clamp(start, 0, size);
        int to = clamp(stop, size, size);
        ImmutableList.Builder<T> slice = ImmutableList.builder();
        for (int i = from; i < to; i += step) {
            slice.add(cache.get(i));
        }
        return slice.build();
    }

    /**
     * Return a sequential {@link Stream} over this sequence.
     *
     * @return the stream
     */
    public Stream<T> stream() {
        return Streams.stream(this);
    }

    /**
     * Return every element, draining the source. The same unmodifiable view
     * is returned on every call.
     *
     * @return the elements
     */
    public List<T> toList() {
        drain();
        return view;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("consumed", cache.size())
                .add("complete", complete).toString();
    }

    /**
     * Resolve a slice bound against {@code size}.
     *
     * @param bound
     * @param absent the value to use if {@code bound} is {@code null}
     * @param size
     * @return the index
     */
    private static int clamp(@Nullable Integer bound, int absent, int size) {
        if(bound == null) {
            return absent;
        }
        else if(bound < 0) {
            return Math.max(0, size + bound);
        }
        else {
            return Math.min(bound, size);
        }
    }

    /**
     * Pull every remaining element from the source.
     */
    private void drain() {
        while (pull()) {
            continue;
        }
    }

    /**
     * Pull from the source until {@code count} elements are cached or the
     * source is exhausted.
     *
     * @param count
     */
    private void fill(int count) {
        while (cache.size() < count && pull()) {
            continue;
        }
    }

    /**
     * Pull one element from the source into the cache.
     *
     * @return {@code true} if an element was pulled
     */
    private boolean pull() {
        if(complete) {
            return false;
        }
        else if(source.hasNext()) {
            cache.add(source.next());
            return true;
        }
        else {
            complete = true;
            return false;
        }
    }

}
