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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.ValidationException;

import com.google.common.base.MoreObjects;

/**
 * One entry of a {@link FieldCatalog}: a declared field name, the name of the
 * field on the remote layout and the field's {@link FieldType}.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class FieldDefinition {

    private static final Pattern REPETITION = Pattern
            .compile("(.*)\\[(\\d+)\\]");

    private final String name;
    private final String remoteName;
    private final FieldType type;

    FieldDefinition(String name, String remoteName, FieldType type) {
        this.name = name;
        this.remoteName = remoteName;
        this.type = type;
    }

    public String name() {
        return name;
    }

    public String remoteName() {
        return remoteName;
    }

    /**
     * Return the remote name without a trailing {@code [n]} repetition
     * suffix.
     *
     * @return the base name
     */
    public String remoteBaseName() {
        Matcher matcher = REPETITION.matcher(remoteName);
        return matcher.matches() ? matcher.group(1) : remoteName;
    }

    /**
     * Return the 1-based repetition named by a trailing {@code [n]} in the
     * remote name, or 1 if there is none.
     *
     * @return the repetition
     */
    public int repetition() {
        Matcher matcher = REPETITION.matcher(remoteName);
        return matcher.matches() ? Integer.parseInt(matcher.group(2)) : 1;
    }

    /**
     * Throw a {@link ValidationException} if the field cannot be set
     * directly.
     */
    void checkWritable() {
        if(type == FieldType.CONTAINER) {
            throw ValidationException.format("{} is a container field and "
                    + "can only be changed with an upload", name);
        }
    }

    public FieldType type() {
        return type;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", name)
                .add("remoteName", remoteName).add("type", type).toString();
    }

}
