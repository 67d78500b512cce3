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

/**
 * Performs the remote call for one {@link PageRequest}.
 *
 * @author Jeff Nelson
 */
@FunctionalInterface
public interface PageFetcher<T> {

    /**
     * Fetch the records for {@code request}. The returned page may hold fewer
     * records than the request's limit, but never more.
     *
     * @param request
     * @return the page
     */
    Page<T> fetch(PageRequest request);

}
