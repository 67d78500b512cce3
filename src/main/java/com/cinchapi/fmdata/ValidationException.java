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

import com.cinchapi.common.base.AnyStrings;

/**
 * A {@link ValidationException} is thrown when a query, criterion or field
 * value is malformed. It is always raised locally, before any network call is
 * made.
 *
 * @author Jeff Nelson
 */
@SuppressWarnings("serial")
public class ValidationException extends FileMakerException {

    /**
     * Return a {@link ValidationException} whose message is built from the
     * {@code template} and {@code args} using {@link AnyStrings#format}
     * placeholders.
     *
     * @param template
     * @param args
     * @return the exception
     */
    public static ValidationException format(String template,
            Object... args) {
        return new ValidationException(AnyStrings.format(template, args));
    }

    /**
     * Construct a new instance.
     *
     * @param message
     */
    public ValidationException(String message) {
        super(message);
    }

    /**
     * Construct a new instance.
     *
     * @param message
     * @param cause
     */
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

}
