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
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import com.cinchapi.fmdata.FileMakerClient;
import com.cinchapi.fmdata.FileMakerException;
import com.cinchapi.fmdata.ValidationException;
import com.cinchapi.fmdata.cache.LazyResultCache;
import com.cinchapi.fmdata.portal.PortalPrefetchCoordinator;
import com.cinchapi.fmdata.query.Scripts;
import com.cinchapi.fmdata.result.RecordData;
import com.cinchapi.fmdata.result.RecordsResult;
import com.cinchapi.fmdata.result.WriteResult;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * One remote record, with typed access to the fields its {@link Model}
 * declares.
 * <p>
 * Local changes are tracked and only the changed fields are sent on
 * {@link #save(boolean) save}. Accessing a field the model does not declare
 * fails instead of returning {@code null}.
 * </p>
 * <p>
 * Portals that were prefetched by the query come with the record. Any other
 * declared portal is fetched, page by page, the first time it is
 * {@link #portal(String) accessed}.
 * </p>
 *
 * @author Jeff Nelson
 */
@NotThreadSafe
public final class RecordHandle {

    private final FileMakerClient client;
    private final Model model;
    private final String recordId;
    private String modId;

    /**
     * Declared field name to decoded value.
     */
    private final Map<String, Object> values;

    /**
     * The fields changed since the record was loaded or last saved.
     */
    private final Set<String> dirty = Sets.newLinkedHashSet();

    /**
     * The portal rows that were prefetched or loaded so far, keyed by portal
     * name.
     */
    private final Map<String, LazyResultCache<PortalRecord>> portals;

    /**
     * A flag that indicates the record was deleted.
     */
    private boolean deleted = false;

    /**
     * Construct a new instance.
     *
     * @param client
     * @param model
     * @param data the record as returned by the remote service
     * @param portals the prefetched portal rows, keyed by portal name
     */
    public RecordHandle(FileMakerClient client, Model model, RecordData data,
            Map<String, LazyResultCache<PortalRecord>> portals) {
        this.client = client;
        this.model = model;
        this.recordId = data.recordId();
        this.modId = data.modId();
        this.values = model.decode(data);
        this.portals = Maps.newLinkedHashMap(portals);
    }

    /**
     * Delete the record.
     *
     * @throws com.cinchapi.fmdata.RemoteBusinessException if the remote
     *             service refuses
     */
    public void delete() {
        checkNotDeleted();
        client.deleteRecord(model.layout(), recordId, Scripts.none())
                .raiseIfError();
        deleted = true;
    }

    /**
     * Return the names of the fields changed since the record was loaded or
     * last saved.
     *
     * @return the changed fields
     */
    public Set<String> dirtyFields() {
        return ImmutableSet.copyOf(dirty);
    }

    /**
     * Return the value of the declared {@code field}. A declared field that
     * is not on the layout has no value.
     *
     * @param field
     * @return the value
     * @throws com.cinchapi.fmdata.ValidationException if the field is not
     *             declared
     */
    @SuppressWarnings("unchecked")
    @Nullable
    public <T> T get(String field) {
        model.fields().resolve(field);
        return (T) values.get(field);
    }

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * Return {@code true} if a field was changed locally.
     *
     * @return a boolean
     */
    public boolean isDirty() {
        return !dirty.isEmpty();
    }

    public Model model() {
        return model;
    }

    public String modId() {
        return modId;
    }

    /**
     * Return the rows of the declared portal {@code name}.
     *
     * @param name
     * @return the rows
     * @throws com.cinchapi.fmdata.ValidationException if the portal is not
     *             declared
     */
    public LazyResultCache<PortalRecord> portal(String name) {
        PortalModel portal = model.portal(name);
        return portals.computeIfAbsent(name,
                ignored -> PortalPrefetchCoordinator.onDemand(client, model,
                        recordId, portal));
    }

    public String recordId() {
        return recordId;
    }

    /**
     * Reload the record, dropping local changes and loaded portal rows.
     */
    public void refresh() {
        checkNotDeleted();
        RecordsResult result = client.getRecord(model.layout(), recordId);
        result.raiseIfError();
        RecordData data = result.data().get(0);
        modId = data.modId();
        values.clear();
        values.putAll(model.decode(data));
        dirty.clear();
        portals.clear();
    }

    /**
     * Save the local changes without checking the mod id.
     */
    public void save() {
        save(false);
    }

    /**
     * Send the changed fields, the changed portal rows and the portal rows
     * marked for deletion in one edit. Nothing is sent if there are no
     * changes.
     *
     * @param checkModId if {@code true}, the edit fails when the record was
     *            changed remotely since it was loaded
     * @throws com.cinchapi.fmdata.RemoteBusinessException if the remote
     *             service refuses the edit
     */
    public void save(boolean checkModId) {
        checkNotDeleted();
        Map<String, Object> fieldData = Maps.newLinkedHashMap();
        for (String field : dirty) {
            FieldDefinition definition = model.fields().resolve(field);
            fieldData.put(definition.remoteName(), model.codec()
                    .encode(definition.type(), values.get(field)));
        }
        Map<String, List<Map<String, Object>>> portalData = Maps
                .newLinkedHashMap();
        List<String> deleteRelated = Lists.newArrayList();
        List<PortalRecord> touched = Lists.newArrayList();
        portals.forEach((name, rows) -> {
            for (PortalRecord row : rows.cachedValues()) {
                if(row.isDeleted()) {
                    continue;
                }
                else if(row.isMarkedForDeletion()) {
                    deleteRelated.add(row.deletion());
                    touched.add(row);
                }
                else if(row.isDirty()) {
                    portalData.computeIfAbsent(name,
                            ignored -> Lists.newArrayList()).add(row.changes());
                    touched.add(row);
                }
            }
        });
        if(fieldData.isEmpty() && touched.isEmpty()) {
            return;
        }
        WriteResult result = client.editRecord(model.layout(), recordId,
                fieldData, checkModId ? modId : null, portalData,
                deleteRelated, Scripts.none());
        result.raiseIfError();
        if(result.modId() != null) {
            modId = result.modId();
        }
        dirty.clear();
        touched.forEach(PortalRecord::saved);
    }

    /**
     * Set the declared {@code field} to {@code value} locally.
     *
     * @param field
     * @param value
     * @throws com.cinchapi.fmdata.ValidationException if the field is not
     *             declared or the value does not fit it
     */
    public void set(String field, @Nullable Object value) {
        FieldDefinition definition = model.fields().resolve(field);
        definition.checkWritable();
        model.codec().encode(definition.type(), value);
        values.put(field, value);
        dirty.add(field);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("layout", model.layout()).add("recordId", recordId)
                .add("modId", modId).add("values", values).toString();
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
     * Upload {@code content} into the declared container {@code field} and
     * read back the field's new value. Other local changes are kept.
     *
     * @param field
     * @param filename
     * @param content
     * @throws com.cinchapi.fmdata.ValidationException if the field is not a
     *             declared container field
     * @throws com.cinchapi.fmdata.RemoteBusinessException if the remote
     *             service refuses the upload
     */
    public void upload(String field, String filename, byte[] content) {
        checkNotDeleted();
        FieldDefinition definition = model.fields().resolve(field);
        if(definition.type() != FieldType.CONTAINER) {
            throw ValidationException.format("{} is not a container field",
                    field);
        }
        client.uploadContainer(model.layout(), recordId,
                definition.remoteBaseName(), definition.repetition(),
                filename, content).raiseIfError();
        RecordsResult result = client.getRecord(model.layout(), recordId);
        result.raiseIfError();
        RecordData data = result.data().get(0);
        modId = data.modId();
        values.put(field, model.decode(data).get(field));
    }

    /**
     * Throw a {@link FileMakerException} if the record was deleted.
     */
    private void checkNotDeleted() {
        if(deleted) {
            throw new FileMakerException(
                    "Record " + recordId + " was deleted");
        }
    }

}
