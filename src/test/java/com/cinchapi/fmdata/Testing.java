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

import java.util.Map;

import com.cinchapi.fmdata.model.FieldCatalog;
import com.cinchapi.fmdata.model.FieldType;
import com.cinchapi.fmdata.model.Model;
import com.cinchapi.fmdata.model.PortalModel;
import com.google.common.collect.ImmutableMap;

/**
 * Utilities for unit tests.
 *
 * @author Jeff Nelson
 */
public final class Testing {

    /**
     * The layout of the sample {@link #contacts() model}.
     */
    public static final String LAYOUT = "Contacts";

    /**
     * Return a model of the {@link #LAYOUT} with {@code name}, {@code age}
     * and {@code city} fields and a {@code notes} portal.
     *
     * @return the model
     */
    public static Model contacts() {
        return Model.builder(LAYOUT)
                .fields(FieldCatalog.builder()
                        .field("name", "Name", FieldType.STRING)
                        .field("age", "Age", FieldType.INTEGER)
                        .field("city", "City", FieldType.STRING).build())
                .portal(PortalModel.of("notes", "Notes",
                        FieldCatalog.builder()
                                .field("text", "Text", FieldType.STRING)
                                .build()))
                .build();
    }

    /**
     * Return a {@link FakeFileMakerServer} that serves the {@link #LAYOUT}
     * with its {@code notes} portal and no records.
     *
     * @return the server
     */
    public static FakeFileMakerServer server() {
        return new FakeFileMakerServer().portal(LAYOUT, "notes", "Notes");
    }

    /**
     * Insert a contact.
     *
     * @param server
     * @param name
     * @param age
     * @param city
     * @return the record id
     */
    public static String contact(FakeFileMakerServer server, String name,
            int age, String city) {
        return server.insert(LAYOUT, fields(name, age, city));
    }

    /**
     * Return the remote field data of a contact.
     *
     * @param name
     * @param age
     * @param city
     * @return the field data
     */
    public static Map<String, Object> fields(String name, int age,
            String city) {
        return ImmutableMap.of("Name", name, "Age", age, "City", city);
    }

    private Testing() {/* no-init */}

}
