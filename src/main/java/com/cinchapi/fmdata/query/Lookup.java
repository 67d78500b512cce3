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

import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.ValidationException;
import com.google.common.base.MoreObjects;

/**
 * A parsed lookup of the form {@code field} or {@code field__suffix}, where
 * the suffix names an {@link Operator}. A lookup without a suffix is an
 * {@link Operator#EXACT exact} match.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class Lookup {

    /**
     * The separator between the field and the operator suffix.
     */
    private static final String SEPARATOR = "__";

    /**
     * Parse the {@code lookup}.
     *
     * @param lookup
     * @return the parsed lookup
     * @throws ValidationException if the suffix is unknown or the field is
     *             missing
     */
    public static Lookup parse(String lookup) {
        int index = lookup.indexOf(SEPARATOR);
        String field;
        Operator operator;
        if(index < 0) {
            field = lookup;
            operator = Operator.EXACT;
        }
        else {
            field = lookup.substring(0, index);
            operator = Operator
                    .forSuffix(lookup.substring(index + SEPARATOR.length()));
        }
        if(field.isEmpty()) {
            throw ValidationException.format("Lookup {} does not name a field",
                    lookup);
        }
        return new Lookup(field, operator);
    }

    private final String field;
    private final Operator operator;

    private Lookup(String field, Operator operator) {
        this.field = field;
        this.operator = operator;
    }

    public String field() {
        return field;
    }

    public Operator operator() {
        return operator;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("field", field)
                .add("operator", operator).toString();
    }

}
