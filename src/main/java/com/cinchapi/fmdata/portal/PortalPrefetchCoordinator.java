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
package com.cinchapi.fmdata.portal;

import java.util.List;
import java.util.Map;

import javax.annotation.concurrent.Immutable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cinchapi.fmdata.FileMakerClient;
import com.cinchapi.fmdata.cache.LazyResultCache;
import com.cinchapi.fmdata.model.Model;
import com.cinchapi.fmdata.model.PortalModel;
import com.cinchapi.fmdata.model.PortalRecord;
import com.cinchapi.fmdata.paginate.Page;
import com.cinchapi.fmdata.paginate.PageFetcher;
import com.cinchapi.fmdata.paginate.PageRequest;
import com.cinchapi.fmdata.paginate.Paginator;
import com.cinchapi.fmdata.paginate.Window;
import com.cinchapi.fmdata.query.PortalRequest;
import com.cinchapi.fmdata.query.Scripts;
import com.cinchapi.fmdata.result.PortalRowData;
import com.cinchapi.fmdata.result.RecordData;
import com.cinchapi.fmdata.result.RecordsResult;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Pages through the portals of parent records.
 * <p>
 * For a portal that the query prefetches, the first page of rows arrives with
 * the parent record and is {@link #attach(RecordData) attached} to it when
 * the parent is decoded; further pages are fetched from the parent record as
 * they are read. A portal that was not prefetched is fetched
 * {@link #onDemand(FileMakerClient, Model, String, PortalModel) on demand},
 * starting with its first page. Both ways go through a {@link Paginator}
 * scoped to the single parent, so rows are never repeated.
 * </p>
 *
 * @author Jeff Nelson
 */
@Immutable
public final class PortalPrefetchCoordinator {

    private static final Logger log = LoggerFactory
            .getLogger(PortalPrefetchCoordinator.class);

    /**
     * Return the rows of {@code portal} for the parent {@code recordId},
     * fetched page by page when they are read.
     *
     * @param client
     * @param model the parent's model
     * @param recordId the parent's record id
     * @param portal
     * @return the rows
     */
    public static LazyResultCache<PortalRecord> onDemand(
            FileMakerClient client, Model model, String recordId,
            PortalModel portal) {
        return new LazyResultCache<>(new Paginator<>(Window.ALL,
                PortalRequest.DEFAULT_CHUNK_SIZE,
                request -> fetch(client, model, recordId, portal, request),
                PortalRecord::recordId));
    }

    /**
     * Fetch one page of {@code portal} rows through the parent record.
     *
     * @param client
     * @param model
     * @param recordId
     * @param portal
     * @param request
     * @return the page
     */
    private static Page<PortalRecord> fetch(FileMakerClient client,
            Model model, String recordId, PortalModel portal,
            PageRequest request) {
        log.debug("Fetching {} rows of portal {} for record {} at offset {}",
                request.limit(), portal.name(), recordId, request.offset());
        PortalRequest page = PortalRequest
                .of(portal.name(), request.offset(), request.limit())
                .withChunkSize(request.limit());
        RecordsResult result = client.getRecord(model.layout(), recordId,
                ImmutableList.of(page), Scripts.none(), null);
        result.raiseIfError();
        List<RecordData> data = result.data();
        if(data.isEmpty()) {
            return Page.empty();
        }
        else {
            return toPage(model, portal, data.get(0).portalData()
                    .getOrDefault(portal.name(), ImmutableList.of()));
        }
    }

    /**
     * Return the {@code rows} as a page of {@link PortalRecord
     * PortalRecords}.
     *
     * @param model
     * @param portal
     * @param rows
     * @return the page
     */
    private static Page<PortalRecord> toPage(Model model, PortalModel portal,
            List<PortalRowData> rows) {
        ImmutableList.Builder<PortalRecord> records = ImmutableList.builder();
        for (PortalRowData row : rows) {
            records.add(new PortalRecord(portal, model.codec(), row));
        }
        return Page.of(records.build());
    }

    private final FileMakerClient client;
    private final Model model;
    private final Map<String, PortalRequest> requests;

    /**
     * Construct a new instance.
     *
     * @param client
     * @param model
     * @param requests the portals to prefetch, keyed by portal name
     * @throws com.cinchapi.fmdata.ValidationException if a portal is not
     *             declared by the {@code model}
     */
    public PortalPrefetchCoordinator(FileMakerClient client, Model model,
            Map<String, PortalRequest> requests) {
        requests.keySet().forEach(model::portal);
        this.client = client;
        this.model = model;
        this.requests = ImmutableMap.copyOf(requests);
    }

    /**
     * Return the rows of every prefetched portal of {@code parent}, keyed by
     * portal name. The rows that came with {@code parent} serve as the first
     * page.
     *
     * @param parent
     * @return the rows
     */
    public Map<String, LazyResultCache<PortalRecord>> attach(
            RecordData parent) {
        ImmutableMap.Builder<String, LazyResultCache<PortalRecord>> attached = ImmutableMap
                .builder();
        Map<String, List<PortalRowData>> prefetched = parent.portalData();
        String recordId = parent.recordId();
        requests.forEach((name, request) -> {
            PortalModel portal = model.portal(name);
            Page<PortalRecord> first = toPage(model, portal,
                    prefetched.getOrDefault(name, ImmutableList.of()));
            Integer limit = request.limit();
            Window window = Window.of(request.offset(),
                    limit == null ? null : request.offset() + limit);
            PageFetcher<PortalRecord> fetcher = page -> page
                    .offset() == request.offset() ? first
                            : fetch(client, model, recordId, portal, page);
            attached.put(name, new LazyResultCache<>(new Paginator<>(window,
                    request.chunkSize(), fetcher, PortalRecord::recordId)));
        });
        return attached.build();
    }

    /**
     * Return the portal requests to send with each page of parent records.
     *
     * @return the requests
     */
    public List<PortalRequest> requests() {
        return ImmutableList.copyOf(requests.values());
    }

}
