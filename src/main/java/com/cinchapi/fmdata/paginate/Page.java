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

import javax.annotation.concurrent.Immutable;

import com.google.common.collect.ImmutableList;

/**
 * The items returned for one {@link PageRequest}.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class Page<T> {

    /**
     * Return an empty {@link Page}.
     *
     * @return the page
     */
    public static <T> Page<T> empty() {
        return new Page<>(ImmutableList.of());
    }

    /**
     * Return a {@link Page} with the {@code items}.
     *
     * @param items
     * @return the page
     */
    public static <T> Page<T> of(List<T> items) {
        return new Page<>(ImmutableList.copyOf(items));
    }

    private final List<T> items;

    private Page(List<T> items) {
        this.items = items;
    }

    public List<T> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

}
