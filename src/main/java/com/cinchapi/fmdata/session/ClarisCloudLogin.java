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
import java.util.function.Supplier;

import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.FileMakerClient;
import com.cinchapi.fmdata.SessionException;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A {@link LoginProvider} for databases hosted on Claris Cloud, which
 * authenticates with the FMID token of a Claris ID.
 * <p>
 * A Claris ID signs in through Amazon Cognito (user pool
 * {@code us-west-2_NqkuZcXQY}, app client
 * {@code 4l9rvl4mv5es1eep1qe97cautn}). The {@code fmidTokens} supplier
 * performs that exchange and is asked for a token on every login.
 * </p>
 *
 * @author Jeff Nelson
 */
@Immutable
public final class ClarisCloudLogin implements LoginProvider {

    private final Supplier<String> fmidTokens;
    private final List<DataSourceProvider> dataSources;

    /**
     * Construct a new instance.
     *
     * @param fmidTokens supplies the FMID token of the Claris ID
     * @param dataSources
     */
    public ClarisCloudLogin(Supplier<String> fmidTokens,
            DataSourceProvider... dataSources) {
        this.fmidTokens = fmidTokens;
        this.dataSources = ImmutableList.copyOf(dataSources);
    }

    @Override
    public String login(FileMakerClient client) {
        String fmidToken = fmidTokens.get();
        if(Strings.isNullOrEmpty(fmidToken)) {
            throw new SessionException("No FMID token for the Claris ID");
        }
        return LoginProvider.tokenOf(
                client.rawLoginClarisCloud(fmidToken, dataSources));
    }

}
