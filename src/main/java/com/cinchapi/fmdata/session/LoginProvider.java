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

import com.cinchapi.fmdata.FileMakerClient;
import com.cinchapi.fmdata.SessionException;
import com.cinchapi.fmdata.result.LoginResult;
import com.cinchapi.fmdata.result.Message;

/**
 * A strategy for obtaining a new session token.
 *
 * @author Jeff Nelson
 */
@FunctionalInterface
public interface LoginProvider {

    /**
     * Return the token from {@code result} or throw a
     * {@link SessionException} if the login failed.
     *
     * @param result
     * @return the token
     * @throws SessionException
     */
    static String tokenOf(LoginResult result) {
        if(result.hasErrors()) {
            Message error = result.errors().get(0);
            throw new SessionException(error);
        }
        String token = result.token();
        if(token == null) {
            throw new SessionException(
                    "The login response did not contain a token");
        }
        return token;
    }

    /**
     * Perform a login against the {@code client}'s database and return the
     * new token.
     *
     * @param client
     * @return the token
     * @throws SessionException if the login is rejected
     */
    String login(FileMakerClient client);

}
