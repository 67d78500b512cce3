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

import java.util.List;

import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.FileMakerClient;
import com.google.common.collect.ImmutableList;

/**
 * A {@link LoginProvider} that authenticates with an account name and
 * password.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class UsernamePasswordLogin implements LoginProvider {

    private final String username;
    private final String password;
    private final List<DataSourceProvider> dataSources;

    /**
     * Construct a new instance.
     *
     * @param username
     * @param password
     * @param dataSources
     */
    public UsernamePasswordLogin(String username, String password,
            DataSourceProvider... dataSources) {
        this.username = username;
        this.password = password;
        this.dataSources = ImmutableList.copyOf(dataSources);
    }

    @Override
    public String login(FileMakerClient client) {
        return LoginProvider.tokenOf(
                client.rawLoginUsernamePassword(username, password,
                        dataSources));
    }

}
