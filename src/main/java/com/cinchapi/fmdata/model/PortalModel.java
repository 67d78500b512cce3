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

import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.ValidationException;
import com.google.common.base.MoreObjects;

/**
 * A portal on a model's layout: the portal object name, the table occurrence
 * its rows come from and the fields of those rows.
 * <p>
 * The remote service keys row values by {@code tableOccurrence::field}.
 * </p>
 *
 * @author Jeff Nelson
 */
@Immutable
public final class PortalModel {

    /**
     * Return a {@link PortalModel}.
     *
     * @param name the portal object name on the layout
     * @param tableOccurrence
     * @param fields
     * @return the portal model
     */
    public static PortalModel of(String name, String tableOccurrence,
            FieldCatalog fields) {
        if(name == null || name.isEmpty()) {
            throw new ValidationException("A portal needs a name");
        }
        else if(tableOccurrence == null || tableOccurrence.isEmpty()) {
            throw ValidationException
                    .format("Portal {} needs a table occurrence", name);
        }
        return new PortalModel(name, tableOccurrence, fields);
    }

    private final String name;
    private final String tableOccurrence;
    private final FieldCatalog fields;

    private PortalModel(String name, String tableOccurrence,
            FieldCatalog fields) {
        this.name = name;
        this.tableOccurrence = tableOccurrence;
        this.fields = fields;
    }

    public FieldCatalog fields() {
        return fields;
    }

    public String name() {
        return name;
    }

    /**
     * Return the key of {@code field} in the rows of this portal.
     *
     * @param field
     * @return the key
     */
    public String remoteKey(FieldDefinition field) {
        return tableOccurrence + "::" + field.remoteName();
    }

    public String tableOccurrence() {
        return tableOccurrence;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", name)
                .add("tableOccurrence", tableOccurrence).toString();
    }

}
