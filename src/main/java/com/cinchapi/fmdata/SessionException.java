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
package com.cinchapi.fmdata;

import javax.annotation.Nullable;

import com.cinchapi.fmdata.result.Message;

/**
 * A {@link SessionException} is thrown when a session cannot be established or
 * kept alive: a failed login, a login that is retried too fast or a token that
 * is still rejected after the one re-login the library performs.
 *
 * @author Jeff Nelson
 */
@SuppressWarnings("serial")
public class SessionException extends FileMakerException {

    /**
     * The remote error that caused this exception, if any.
     */
    @Nullable
    private final Message error;

    /**
     * Construct a new instance.
     *
     * @param message
     */
    public SessionException(String message) {
        super(message);
        this.error = null;
    }

    /**
     * Construct a new instance.
     *
     * @param message
     * @param cause
     */
    public SessionException(String message, Throwable cause) {
        super(message, cause);
        this.error = null;
    }

    /**
     * Construct a new instance.
     *
     * @param error the remote error entry
     */
    public SessionException(Message error) {
        super("FileMaker Server returned error " + error.code() + ", "
                + error.message());
        this.error = error;
    }

    /**
     * Return the remote error that caused this exception or {@code null} if
     * the failure was detected locally.
     *
     * @return the remote error
     */
    @Nullable
    public Message error() {
        return error;
    }

}
