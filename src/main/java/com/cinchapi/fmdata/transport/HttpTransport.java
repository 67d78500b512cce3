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

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.fmdata.TransportException;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * A {@link Transport} that uses the JDK's {@link HttpClient}.
 * <p>
 * The Data API reports remote errors with a non-2xx status and a json body,
 * so the status code alone never fails a call; only an unreachable service
 * or a body that is not a json object does.
 * </p>
 *
 * @author Jeff Nelson
 */
@ThreadSafe
public final class HttpTransport implements Transport {

    private static final Logger log = LoggerFactory
            .getLogger(HttpTransport.class);

    /**
     * Shared json codec.
     */
    private static final Gson GSON = new Gson();

    /**
     * The scheme, host and port of the service, without a trailing slash.
     */
    private final String baseUrl;

    /**
     * The underlying client.
     */
    private final HttpClient client;

    /**
     * The maximum time to wait for a reply.
     */
    private final Duration readTimeout;

    /**
     * Construct a new instance.
     *
     * @param baseUrl
     * @param connectTimeout
     * @param readTimeout
     */
    public HttpTransport(String baseUrl, Duration connectTimeout,
            Duration readTimeout) {
        this.baseUrl = baseUrl.endsWith("/")
                ? baseUrl.substring(0, baseUrl.length() - 1)
                : baseUrl;
        this.readTimeout = readTimeout;
        this.client = HttpClient.newBuilder().connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public JsonObject send(String method, String path,
            Map<String, String> headers, @Nullable JsonObject body) {
        HttpRequest.Builder request = HttpRequest
                .newBuilder(URI.create(baseUrl + path)).timeout(readTimeout)
                .method(method, body == null ? BodyPublishers.noBody()
                        : BodyPublishers.ofString(GSON.toJson(body)));
        headers.forEach(request::header);
        return exchange(method, path, request.build());
    }

    @Override
    public JsonObject upload(String path, Map<String, String> headers,
            String filename, byte[] content) {
        String boundary = "fmdata-" + UUID.randomUUID();
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"upload\"; filename=\""
                + filename.replace("\"", "%22") + "\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n";
        String tail = "\r\n--" + boundary + "--\r\n";
        HttpRequest.Builder request = HttpRequest
                .newBuilder(URI.create(baseUrl + path)).timeout(readTimeout)
                .POST(BodyPublishers.ofByteArrays(ImmutableList.of(
                        head.getBytes(StandardCharsets.UTF_8), content,
                        tail.getBytes(StandardCharsets.UTF_8))));
        headers.forEach(request::header);
        request.header("Content-Type",
                "multipart/form-data; boundary=" + boundary);
        log.debug("Uploading {} bytes as {} to {}", content.length, filename,
                path);
        return exchange("POST", path, request.build());
    }

    /**
     * Send the {@code request} and decode the json reply.
     *
     * @param method
     * @param path
     * @param request
     * @return the decoded reply
     */
    private JsonObject exchange(String method, String path,
            HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = client.send(request, BodyHandlers.ofString());
        }
        catch (IOException e) {
            throw new TransportException(AnyStrings.format(
                    "Unable to {} {}: {}", method, path, e.getMessage()), e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(AnyStrings
                    .format("Interrupted while calling {} {}", method, path),
                    e);
        }
        log.debug("{} {} returned HTTP {}", method, path,
                response.statusCode());
        try {
            JsonObject json = GSON.fromJson(response.body(), JsonObject.class);
            if(json == null) {
                throw new TransportException(AnyStrings.format(
                        "{} {} returned HTTP {} with an empty body", method,
                        path, response.statusCode()));
            }
            return json;
        }
        catch (JsonParseException e) {
            throw new TransportException(AnyStrings.format(
                    "{} {} returned HTTP {} with a body that is not json",
                    method, path, response.statusCode()), e);
        }
    }

}
