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

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.ValidationException;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

/**
 * The registration table of the fields a model declares. It maps each
 * declared field name to the remote field name and the {@link FieldType}.
 * <p>
 * A catalog is built once, with {@link #builder()}, and then shared by every
 * query and record of the model.
 * </p>
 *
 * @author Jeff Nelson
 */
@Immutable
public final class FieldCatalog {

    /**
     * Names that cannot be declared because records and queries use them.
     */
    private static final Set<String> RESERVED_NAMES = ImmutableSet.of(
            "record_id", "mod_id", "portal_name", "table_occurrence", "model",
            "portal", "layout");

    /**
     * Return a new {@link Builder}.
     *
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Throw a {@link ValidationException} if {@code name} cannot be declared.
     *
     * @param name
     */
    static void checkName(String name) {
        if(name == null || name.isEmpty()) {
            throw new ValidationException("A field name cannot be empty");
        }
        else if(name.contains("__")) {
            throw ValidationException.format(
                    "Field name {} cannot contain a double underscore", name);
        }
        else if(name.startsWith("_")) {
            throw ValidationException
                    .format("Field name {} cannot start with an underscore",
                            name);
        }
        else if(RESERVED_NAMES.contains(name)) {
            throw ValidationException.format("Field name {} is reserved",
                    name);
        }
    }

    /**
     * The declared fields, in declaration order.
     */
    private final Map<String, FieldDefinition> fields;

    /**
     * The declared fields keyed by remote name.
     */
    private final Map<String, FieldDefinition> remote;

    private FieldCatalog(Map<String, FieldDefinition> fields) {
        this.fields = ImmutableMap.copyOf(fields);
        ImmutableMap.Builder<String, FieldDefinition> remote = ImmutableMap
                .builder();
        for (FieldDefinition field : fields.values()) {
            remote.put(field.remoteName(), field);
        }
        this.remote = remote.build();
    }

    /**
     * Return the field whose remote name is {@code remoteName}, if declared.
     *
     * @param remoteName
     * @return the field
     */
    public Optional<FieldDefinition> byRemoteName(String remoteName) {
        return Optional.ofNullable(remote.get(remoteName));
    }

    /**
     * Return {@code true} if {@code name} is declared.
     *
     * @param name
     * @return a boolean
     */
    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    /**
     * Return the declared fields, in declaration order.
     *
     * @return the fields
     */
    public Collection<FieldDefinition> fields() {
        return fields.values();
    }

    /**
     * Return the declared field {@code name}.
     *
     * @param name
     * @return the field
     * @throws ValidationException if {@code name} is not declared
     */
    public FieldDefinition resolve(String name) {
        FieldDefinition field = fields.get(name);
        if(field == null) {
            throw ValidationException.format("{} is not a declared field",
                    name);
        }
        return field;
    }

    /**
     * Builds a {@link FieldCatalog}.
     *
     * @author Jeff Nelson
     */
    public static final class Builder {

        private final Map<String, FieldDefinition> fields = Maps
                .newLinkedHashMap();

        private Builder() {}

        /**
         * Build the {@link FieldCatalog}.
         *
         * @return the catalog
         */
        public FieldCatalog build() {
            return new FieldCatalog(fields);
        }

        /**
         * Declare a field whose remote name is its {@code name}.
         *
         * @param name
         * @param type
         * @return this
         */
        public Builder field(String name, FieldType type) {
            return field(name, name, type);
        }

        /**
         * Declare a field.
         *
         * @param name
         * @param remoteName
         * @param type
         * @return this
         * @throws ValidationException if {@code name} cannot be declared or is
         *             declared twice
         */
        public Builder field(String name, String remoteName, FieldType type) {
            checkName(name);
            if(remoteName == null || remoteName.isEmpty()) {
                throw ValidationException.format(
                        "Field {} needs a remote name", name);
            }
            else if(fields.containsKey(name)) {
                throw ValidationException.format(
                        "Field {} is declared more than once", name);
            }
            fields.put(name, new FieldDefinition(name, remoteName, type));
            return this;
        }

    }

}
