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

/**
 * The lifecycle states of a {@link SessionController}.
 *
 * @author Jeff Nelson
 */
public enum SessionState {

    /**
     * No login was ever attempted or the session was logged out.
     */
    NO_SESSION,

    /**
     * A login call is in flight.
     */
    LOGGING_IN,

    /**
     * A token is held and believed to be valid.
     */
    ACTIVE,

    /**
     * The remote service rejected the held token.
     */
    INVALIDATED,

    /**
     * The most recent login attempt failed.
     */
    FAILED
}
