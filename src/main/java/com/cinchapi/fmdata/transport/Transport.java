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
package com.cinchapi.fmdata.transport;

import java.util.Map;

import javax.annotation.Nullable;

import com.cinchapi.fmdata.TransportException;
import com.google.gson.JsonObject;

/**
 * The network boundary of the library: every Data API call, including login,
 * is one {@link #send(String, String, Map, JsonObject) send}, except for
 * container uploads, which are one
 * {@link #upload(String, Map, String, byte[]) upload}.
 * <p>
 * Implementations own connection handling and timeouts. A response that
 * carries remote error entries is still a response and must be returned, not
 * thrown; only failures to reach the service or to decode its reply are
 * {@link TransportException TransportExceptions}.
 * </p>
 *
 * @author Jeff Nelson
 */
public interface Transport {

    /**
     * Send one request and return the decoded json reply.
     *
     * @param method the HTTP method
     * @param path the path, including any query string, relative to the
     *            service's base url
     * @param headers the request headers
     * @param body the request body or {@code null}
     * @return the decoded reply
     * @throws TransportException
     */
    JsonObject send(String method, String path, Map<String, String> headers,
            @Nullable JsonObject body);

    /**
     * POST {@code content} as the {@code upload} part of a multipart form
     * and return the decoded json reply.
     *
     * @param path the path relative to the service's base url
     * @param headers the request headers, without a content type
     * @param filename the file name reported for the part
     * @param content the file content
     * @return the decoded reply
     * @throws TransportException
     */
    JsonObject upload(String path, Map<String, String> headers,
            String filename, byte[] content);

}
