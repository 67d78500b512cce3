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
package com.cinchapi.fmdata.session;

import java.util.Map;

/**
 * Provides the credentials of one external data source that the database
 * relies on. They are sent with the login request.
 *
 * @author Jeff Nelson
 */
@FunctionalInterface
public interface DataSourceProvider {

    /**
     * Return the {@code fmDataSource} entry for the login request.
     *
     * @return the entry
     */
    Map<String, String> provide();

}
