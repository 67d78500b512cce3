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

/**
 * The root of every failure that is raised by this library.
 * <p>
 * Each subclass names one category of failure so that callers can
 * programmatically decide how to react (e.g. fix a query, re-authenticate,
 * surface a remote error to a user or retry a network call).
 * </p>
 *
 * @author Jeff Nelson
 */
@SuppressWarnings("serial")
public class FileMakerException extends RuntimeException {

    /**
     * Construct a new instance.
     *
     * @param message
     */
    public FileMakerException(String message) {
        super(message);
    }

    /**
     * Construct a new instance.
     *
     * @param message
     * @param cause
     */
    public FileMakerException(String message, Throwable cause) {
        super(message, cause);
    }

}
