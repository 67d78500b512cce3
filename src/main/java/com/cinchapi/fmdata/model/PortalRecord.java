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

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import com.cinchapi.fmdata.result.PortalRowData;
import com.google.common.base.MoreObjects;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * One row of a portal, with typed access to the fields its
 * {@link PortalModel} declares.
 * <p>
 * Changes made with {@link #set(String, Object)} and
 * {@link #markForDeletion()} stay local until the parent
 * {@link RecordHandle#save(boolean) record is saved}.
 * </p>
 *
 * @author Jeff Nelson
 */
@NotThreadSafe
public final class PortalRecord {

    private final PortalModel portal;
    private final Codec codec;
    private final String recordId;
    private final String modId;

    /**
     * Declared field name to decoded value.
     */
    private final Map<String, Object> values;

    /**
     * The fields changed since the row was loaded or last saved.
     */
    private final Set<String> dirty = Sets.newLinkedHashSet();

    private boolean markedForDeletion = false;

    /**
     * A flag that indicates the deletion of this row was saved.
     */
    private boolean deleted = false;

    /**
     * Construct a new instance.
     *
     * @param portal
     * @param codec
     * @param row
     */
    public PortalRecord(PortalModel portal, Codec codec, PortalRowData row) {
        this.portal = portal;
        this.codec = codec;
        this.recordId = row.recordId();
        this.modId = row.modId();
        Map<String, Object> data = row.values();
        this.values = Maps.newLinkedHashMap();
        for (FieldDefinition field : portal.fields().fields()) {
            String key = portal.remoteKey(field);
            if(data.containsKey(key)) {
                values.put(field.name(),
                        codec.decode(field.type(), data.get(key)));
            }
        }
    }

    /**
     * Return the value of the declared {@code field}.
     *
     * @param field
     * @return the value
     * @throws com.cinchapi.fmdata.ValidationException if the field is not
     *             declared
     */
    @SuppressWarnings("unchecked")
    @Nullable
    public <T> T get(String field) {
        portal.fields().resolve(field);
        return (T) values.get(field);
    }

    /**
     * Return {@code true} if a field was changed locally.
     *
     * @return a boolean
     */
    public boolean isDirty() {
        return !dirty.isEmpty();
    }

    /**
     * Return {@code true} if the parent record was saved after this row was
     * {@link #markForDeletion() marked for deletion}.
     *
     * @return a boolean
     */
    public boolean isDeleted() {
        return deleted;
    }

    public boolean isMarkedForDeletion() {
        return markedForDeletion;
    }

    /**
     * Mark this row to be deleted when the parent record is saved.
     */
    public void markForDeletion() {
        markedForDeletion = true;
    }

    public String modId() {
        return modId;
    }

    public PortalModel portal() {
        return portal;
    }

    public String recordId() {
        return recordId;
    }

    /**
     * Set the declared {@code field} to {@code value}.
     *
     * @param field
     * @param value
     * @throws com.cinchapi.fmdata.ValidationException if the field is not
     *             declared or the value does not fit it
     */
    public void set(String field, @Nullable Object value) {
        FieldDefinition definition = portal.fields().resolve(field);
        definition.checkWritable();
        codec.encode(definition.type(), value);
        values.put(field, value);
        dirty.add(field);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("portal", portal.name())
                .add("recordId", recordId).add("modId", modId)
                .add("dirty", dirty).toString();
    }

    /**
     * Return the declared field values.
     *
     * @return the values
     */
    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Return the row entry to send as part of the parent's portal data.
     *
     * @return the entry
     */
    Map<String, Object> changes() {
        Map<String, Object> changes = Maps.newLinkedHashMap();
        changes.put("recordId", recordId);
        for (String field : dirty) {
            FieldDefinition definition = portal.fields().resolve(field);
            changes.put(portal.remoteKey(definition),
                    codec.encode(definition.type(), values.get(field)));
        }
        return changes;
    }

    /**
     * Return the entry that deletes this row through the parent's edit.
     *
     * @return the entry
     */
    String deletion() {
        return portal.tableOccurrence() + "." + recordId;
    }

    /**
     * Forget the local changes after they were saved.
     */
    void saved() {
        dirty.clear();
        if(markedForDeletion) {
            deleted = true;
        }
    }

}
