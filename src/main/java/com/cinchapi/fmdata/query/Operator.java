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
package com.cinchapi.fmdata.query;

import java.util.Map;

import javax.annotation.Nullable;

import com.cinchapi.fmdata.ValidationException;
import com.google.common.collect.ImmutableMap;

/**
 * The comparisons a {@link Criterion} can express in a find request.
 * <p>
 * Operators that can be named in a lookup (e.g. {@code age__gte}) have a
 * {@link #suffix()}.
 * </p>
 *
 * @author Jeff Nelson
 */
public enum Operator {
    EXACT("exact"),
    STARTS_WITH("startswith"),
    ENDS_WITH("endswith"),
    CONTAINS("contains"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    RANGE("range"),
    RAW("raw"),
    EMPTY(null),
    NOT_EMPTY(null),
    BLANK(null);

    /**
     * Lookup suffix to operator.
     */
    private static final Map<String, Operator> SUFFIXES;
    static {
        ImmutableMap.Builder<String, Operator> suffixes = ImmutableMap
                .builder();
        for (Operator operator : values()) {
            if(operator.suffix != null) {
                suffixes.put(operator.suffix, operator);
            }
        }
        SUFFIXES = suffixes.build();
    }

    /**
     * Return the {@link Operator} named by a lookup {@code suffix}.
     *
     * @param suffix
     * @return the operator
     * @throws ValidationException if no operator has the {@code suffix}
     */
    public static Operator forSuffix(String suffix) {
        Operator operator = SUFFIXES.get(suffix);
        if(operator == null) {
            throw ValidationException.format(
                    "{} is not a supported lookup; use one of {}", suffix,
                    SUFFIXES.keySet());
        }
        return operator;
    }

    @Nullable
    private final String suffix;

    Operator(@Nullable String suffix) {
        this.suffix = suffix;
    }

    /**
     * Return the lookup suffix or {@code null} if the operator cannot be
     * named in a lookup.
     *
     * @return the suffix
     */
    @Nullable
    public String suffix() {
        return suffix;
    }

}
