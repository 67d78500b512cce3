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

import com.cinchapi.fmdata.result.Message;

/**
 * A {@link RemoteBusinessException} carries an error entry that the remote
 * service returned for an otherwise successful call (e.g. a missing record or
 * a mod id mismatch). These are never retried.
 *
 * @author Jeff Nelson
 */
@SuppressWarnings("serial")
public class RemoteBusinessException extends FileMakerException {

    /**
     * The remote error.
     */
    private final Message error;

    /**
     * Construct a new instance.
     *
     * @param error
     */
    public RemoteBusinessException(Message error) {
        super("FileMaker Server returned error " + error.code() + ", "
                + error.message());
        this.error = error;
    }

    /**
     * Return the remote error code.
     *
     * @return the code
     */
    public int code() {
        return error.code();
    }

    /**
     * Return the remote error entry.
     *
     * @return the error
     */
    public Message error() {
        return error;
    }

}
