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

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Unit tests for {@link Paginator}.
 *
 * @author Jeff Nelson
 */
public class PaginatorTest {

    /**
     * A {@link PageFetcher} over a mutable list of ids that records every
     * request it gets.
     */
    private static final class ListFetcher implements PageFetcher<String> {

        private final List<String> source;
        private final List<PageRequest> requests = Lists.newArrayList();

        ListFetcher(List<String> source) {
            this.source = source;
        }

        @Override
        public Page<String> fetch(PageRequest request) {
            requests.add(request);
            int from = Math.min(request.offset(), source.size());
            int to = Math.min(request.offset() + request.limit(),
                    source.size());
            return Page.of(ImmutableList.copyOf(source.subList(from, to)));
        }

    }

    private static List<String> ids(int count) {
        List<String> ids = Lists.newArrayList();
        for (int i = 0; i < count; ++i) {
            ids.add("r" + i);
        }
        return ids;
    }

    @Test
    public void testPartialLastPageEndsPagination() {
        ListFetcher fetcher = new ListFetcher(ids(5));
        Paginator<String> paginator = new Paginator<>(Window.ALL, 2, fetcher,
                id -> id);
        Assert.assertEquals(ids(5), Lists.newArrayList(paginator));
        Assert.assertEquals(ImmutableList.of(PageRequest.of(0, 2),
                PageRequest.of(2, 2), PageRequest.of(4, 2)),
                fetcher.requests);
    }

    @Test
    public void testFullLastPageNeedsProbe() {
        ListFetcher fetcher = new ListFetcher(ids(4));
        Paginator<String> paginator = new Paginator<>(Window.ALL, 2, fetcher,
                id -> id);
        Assert.assertEquals(ids(4), Lists.newArrayList(paginator));
        Assert.assertEquals(3, paginator.pagesRequested());
    }

    @Test
    public void testBoundedWindowNeedsNoProbe() {
        ListFetcher fetcher = new ListFetcher(ids(100));
        Paginator<String> paginator = new Paginator<>(Window.of(3, 8), 2,
                fetcher, id -> id);
        Assert.assertEquals(ImmutableList.of("r3", "r4", "r5", "r6", "r7"),
                Lists.newArrayList(paginator));
        Assert.assertEquals(ImmutableList.of(PageRequest.of(3, 2),
                PageRequest.of(5, 2), PageRequest.of(7, 1)),
                fetcher.requests);
    }

    @Test
    public void testEmptyWindowRequestsNothing() {
        ListFetcher fetcher = new ListFetcher(ids(10));
        Paginator<String> paginator = new Paginator<>(
                Window.of(0, 5).compose(6, 8), 2, fetcher, id -> id);
        Assert.assertFalse(paginator.hasNext());
        Assert.assertTrue(fetcher.requests.isEmpty());
    }

    @Test
    public void testPagesAreRequestedLazily() {
        ListFetcher fetcher = new ListFetcher(ids(10));
        Paginator<String> paginator = new Paginator<>(Window.ALL, 3, fetcher,
                id -> id);
        paginator.next();
        paginator.next();
        paginator.next();
        Assert.assertEquals(1, paginator.pagesRequested());
        paginator.next();
        Assert.assertEquals(2, paginator.pagesRequested());
    }

    @Test
    public void testRecordInsertedBeforeOffsetIsNotRepeated() {
        List<String> source = ids(6);
        ListFetcher fetcher = new ListFetcher(source);
        Paginator<String> paginator = new Paginator<>(Window.ALL, 3, fetcher,
                id -> id);
        List<String> seen = Lists.newArrayList();
        for (int i = 0; i < 3; ++i) {
            seen.add(paginator.next());
        }
        source.add(0, "new");
        paginator.forEachRemaining(seen::add);
        Assert.assertEquals(
                ImmutableList.of("r0", "r1", "r2", "r3", "r4", "r5"), seen);
        Assert.assertEquals(1, paginator.duplicatesDropped());
    }

    @Test
    public void testRecordDeletedBeforeOffsetShiftsOneIntoPassedRange() {
        List<String> source = ids(6);
        ListFetcher fetcher = new ListFetcher(source);
        Paginator<String> paginator = new Paginator<>(Window.ALL, 3, fetcher,
                id -> id);
        List<String> seen = Lists.newArrayList();
        for (int i = 0; i < 3; ++i) {
            seen.add(paginator.next());
        }
        source.remove(0);
        paginator.forEachRemaining(seen::add);
        Assert.assertEquals(ImmutableList.of("r0", "r1", "r2", "r4", "r5"),
                seen);
        Assert.assertEquals(0, paginator.duplicatesDropped());
    }

    @Test
    public void testRecordsWithoutIdAreNeverDropped() {
        ListFetcher fetcher = new ListFetcher(
                Lists.newArrayList("a", "a", "b"));
        Paginator<String> paginator = new Paginator<>(Window.ALL, 10,
                fetcher, id -> null);
        Assert.assertEquals(ImmutableList.of("a", "a", "b"),
                Lists.newArrayList(paginator));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testChunkSizeMustBePositive() {
        new Paginator<>(Window.ALL, 0, new ListFetcher(ids(1)), id -> id);
    }

}
