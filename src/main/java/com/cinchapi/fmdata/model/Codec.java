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
package com.cinchapi.fmdata.model;

import javax.annotation.Nullable;

/**
 * Converts between the Java values of declared fields and the values the
 * remote service exchanges.
 *
 * @author Jeff Nelson
 */
public interface Codec {

    /**
     * Return the remote representation of {@code value} for a field of the
     * {@code type}.
     *
     * @param type
     * @param value
     * @return the remote value
     * @throws com.cinchapi.fmdata.ValidationException if {@code value} does
     *             not fit the {@code type}
     */
    Object encode(FieldType type, @Nullable Object value);

    /**
     * Return the Java value of the remote {@code value} of a field of the
     * {@code type}.
     *
     * @param type
     * @param value
     * @return the Java value
     * @throws com.cinchapi.fmdata.ValidationException if {@code value} cannot
     *             be read as the {@code type}
     */
    @Nullable
    Object decode(FieldType type, @Nullable Object value);

}
