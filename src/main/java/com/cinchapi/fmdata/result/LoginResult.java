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
package com.cinchapi.fmdata.result;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.gson.JsonObject;

/**
 * The result of a call to the sessions endpoint.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class LoginResult extends Result {

    /**
     * Construct a new instance.
     *
     * @param raw
     */
    public LoginResult(JsonObject raw) {
        super(raw);
    }

    /**
     * Return the bearer token that was issued or {@code null} if the login
     * failed.
     *
     * @return the token
     */
    @Nullable
    public String token() {
        return JsonValues.getString(response(), "token");
    }

}
