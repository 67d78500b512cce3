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

import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.FileMakerClient;
import com.cinchapi.fmdata.ValidationException;
import com.cinchapi.fmdata.query.Scripts;
import com.cinchapi.fmdata.result.RecordData;
import com.cinchapi.fmdata.result.RecordsResult;
import com.cinchapi.fmdata.result.WriteResult;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * The static description of the records behind one layout: the layout name,
 * the declared {@link FieldCatalog fields}, the declared {@link PortalModel
 * portals} and the {@link Codec} for field values.
 * <p>
 * A model is built once, with {@link #builder(String)}, and passed to
 * {@link FileMakerClient#query(Model)}. Records only expose the fields the
 * model declares.
 * </p>
 *
 * @author Jeff Nelson
 */
@Immutable
public final class Model {

    /**
     * Return a new {@link Builder} for a model of {@code layout}.
     *
     * @param layout
     * @return the builder
     */
    public static Builder builder(String layout) {
        return new Builder(layout);
    }

    private final String layout;
    private final FieldCatalog fields;
    private final Map<String, PortalModel> portals;
    private final Codec codec;

    private Model(Builder builder) {
        this.layout = builder.layout;
        this.fields = builder.fields;
        this.portals = ImmutableMap.copyOf(builder.portals);
        this.codec = builder.codec;
    }

    public Codec codec() {
        return codec;
    }

    /**
     * Create a record with the {@code values} and return it as the remote
     * service stored it.
     *
     * @param client
     * @param values declared field name to value
     * @return the new record
     * @throws ValidationException if a field is not declared or a value does
     *             not fit its field
     * @throws com.cinchapi.fmdata.RemoteBusinessException if the remote
     *             service rejects the record
     */
    public RecordHandle create(FileMakerClient client,
            Map<String, Object> values) {
        WriteResult created = client.createRecord(layout, encode(values),
                null, Scripts.none());
        created.raiseIfError();
        RecordsResult stored = client.getRecord(layout, created.recordId());
        stored.raiseIfError();
        return new RecordHandle(client, this, stored.data().get(0),
                ImmutableMap.of());
    }

    public FieldCatalog fields() {
        return fields;
    }

    public String layout() {
        return layout;
    }

    /**
     * Return the declared portal {@code name}.
     *
     * @param name
     * @return the portal model
     * @throws ValidationException if the portal is not declared
     */
    public PortalModel portal(String name) {
        PortalModel portal = portals.get(name);
        if(portal == null) {
            throw ValidationException.format(
                    "{} is not a declared portal of layout {}", name, layout);
        }
        return portal;
    }

    public Collection<PortalModel> portals() {
        return portals.values();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("layout", layout)
                .add("fields", fields.fields().size())
                .add("portals", portals.keySet()).toString();
    }

    /**
     * Return the declared field values of {@code record}, keyed by field
     * name. Declared fields that the record does not carry are left out.
     *
     * @param record
     * @return the decoded values
     */
    Map<String, Object> decode(RecordData record) {
        Map<String, Object> data = record.fieldData();
        Map<String, Object> values = Maps.newLinkedHashMap();
        for (FieldDefinition field : fields.fields()) {
            if(data.containsKey(field.remoteName())) {
                values.put(field.name(), codec.decode(field.type(),
                        data.get(field.remoteName())));
            }
        }
        return values;
    }

    /**
     * Return the remote field data for the {@code values}.
     *
     * @param values declared field name to value
     * @return remote field name to remote value
     */
    Map<String, Object> encode(Map<String, Object> values) {
        Map<String, Object> data = Maps.newLinkedHashMap();
        values.forEach((name, value) -> {
            FieldDefinition field = fields.resolve(name);
            field.checkWritable();
            data.put(field.remoteName(), codec.encode(field.type(), value));
        });
        return data;
    }

    /**
     * Builds a {@link Model}.
     *
     * @author Jeff Nelson
     */
    public static class Builder {

        private Codec codec = new DefaultCodec();
        private FieldCatalog fields = FieldCatalog.builder().build();
        private final String layout;
        private final Map<String, PortalModel> portals = Maps
                .newLinkedHashMap();

        private Builder(String layout) {
            Preconditions.checkArgument(layout != null && !layout.isEmpty(),
                    "A model needs a layout");
            this.layout = layout;
        }

        /**
         * Build the configured {@link Model} and return the instance.
         *
         * @return a {@link Model}
         */
        public Model build() {
            return new Model(this);
        }

        /**
         * Set the {@link Codec} for field values.
         *
         * @param codec
         * @return this builder
         */
        public Builder codec(Codec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Set the declared fields.
         *
         * @param fields
         * @return this builder
         */
        public Builder fields(FieldCatalog fields) {
            this.fields = fields;
            return this;
        }

        /**
         * Declare a portal.
         *
         * @param portal
         * @return this builder
         */
        public Builder portal(PortalModel portal) {
            if(portals.containsKey(portal.name())) {
                throw ValidationException.format(
                        "Portal {} is declared more than once", portal.name());
            }
            portals.put(portal.name(), portal);
            return this;
        }

    }

}
