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

import javax.annotation.concurrent.Immutable;

import com.google.common.collect.ImmutableMap;

/**
 * A {@link DataSourceProvider} for a data source that accepts a username and
 * password.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class UsernamePasswordDataSource implements DataSourceProvider {

    private final String database;
    private final String username;
    private final String password;

    /**
     * Construct a new instance.
     *
     * @param database
     * @param username
     * @param password
     */
    public UsernamePasswordDataSource(String database, String username,
            String password) {
        this.database = database;
        this.username = username;
        this.password = password;
    }

    @Override
    public Map<String, String> provide() {
        return ImmutableMap.of("database", database, "username", username,
                "password", password);
    }

}
