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
 * A {@link LoginProvider} that completes an OAuth login whose request id and
 * identifier were obtained from the identity provider.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class OAuthLogin implements LoginProvider {

    private final String requestId;
    private final String identifier;
    private final List<DataSourceProvider> dataSources;

    /**
     * Construct a new instance.
     *
     * @param requestId
     * @param identifier
     * @param dataSources
     */
    public OAuthLogin(String requestId, String identifier,
            DataSourceProvider... dataSources) {
        this.requestId = requestId;
        this.identifier = identifier;
        this.dataSources = ImmutableList.copyOf(dataSources);
    }

    @Override
    public String login(FileMakerClient client) {
        return LoginProvider.tokenOf(
                client.rawLoginOAuth(requestId, identifier, dataSources));
    }

}
