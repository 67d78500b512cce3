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

import java.util.Collections;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Function;

import javax.annotation.concurrent.NotThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Sets;

/**
 * Turns a {@link Window} and a chunk size into the sequence of bounded
 * {@link PageRequest page requests} that covers the window, and yields the
 * records of those pages one at a time.
 * <p>
 * Pages are requested lazily, one whenever the records of the previous page
 * are used up. The paginator stops when a page comes back with fewer records
 * than requested, when the window's stop is reached or when a page is empty.
 * For an unbounded window whose last page was full, one more request is
 * needed to learn that the source is exhausted.
 * </p>
 * <p>
 * The remote set may change between two requests. Any record whose id was
 * already yielded during this pagination is dropped, so no id is ever
 * yielded twice. A record that shifts into the part of the set that was
 * already passed is missed.
 * </p>
 *
 * @author Jeff Nelson
 */
@NotThreadSafe
public final class Paginator<T> extends AbstractIterator<T> {

    private static final Logger log = LoggerFactory.getLogger(Paginator.class);

    private final Window window;
    private final int chunkSize;
    private final PageFetcher<T> fetcher;

    /**
     * Returns the stable remote id of a record, or {@code null} if the record
     * has none.
     */
    private final Function<T, String> identity;

    /**
     * The ids of the records yielded so far.
     */
    private final Set<String> seen = Sets.newHashSet();

    /**
     * The records of the last page that are not yet yielded.
     */
    private Iterator<T> buffer = Collections.emptyIterator();

    /**
     * The offset of the next page request.
     */
    private int offset;

    /**
     * A flag that indicates no more pages are needed.
     */
    private boolean exhausted = false;

    private int pages = 0;
    private int duplicates = 0;

    /**
     * Construct a new instance.
     *
     * @param window
     * @param chunkSize
     * @param fetcher
     * @param identity
     */
    public Paginator(Window window, int chunkSize, PageFetcher<T> fetcher,
            Function<T, String> identity) {
        Preconditions.checkArgument(chunkSize > 0,
                "Chunk size must be positive");
        this.window = window;
        this.chunkSize = chunkSize;
        this.fetcher = fetcher;
        this.identity = identity;
        this.offset = window.start();
    }

    /**
     * Return the number of records dropped because their id was already
     * yielded.
     *
     * @return the duplicate count
     */
    public int duplicatesDropped() {
        return duplicates;
    }

    /**
     * Return the number of page requests issued so far.
     *
     * @return the page count
     */
    public int pagesRequested() {
        return pages;
    }

    @Override
    protected T computeNext() {
        for (;;) {
            if(buffer.hasNext()) {
                T next = buffer.next();
                String id = identity.apply(next);
                if(id != null && !seen.add(id)) {
                    ++duplicates;
                    log.debug("Dropping record {} because it was already "
                            + "returned by an earlier page", id);
                }
                else {
                    return next;
                }
            }
            else if(exhausted) {
                return endOfData();
            }
            else {
                buffer = nextPage().items().iterator();
            }
        }
    }

    /**
     * Request the next page and advance the {@link #offset}.
     *
     * @return the page
     */
    private Page<T> nextPage() {
        Integer stop = window.stop();
        if(stop != null && offset >= stop) {
            exhausted = true;
            return Page.empty();
        }
        int limit = stop == null ? chunkSize
                : Math.min(chunkSize, stop - offset);
        PageRequest request = PageRequest.of(offset, limit);
        log.debug("Requesting page {} at offset {} with limit {}", pages + 1,
                offset, limit);
        Page<T> page = fetcher.fetch(request);
        ++pages;
        offset += page.size();
        if(page.size() < limit || (stop != null && offset >= stop)) {
            exhausted = true;
        }
        return page;
    }

}
