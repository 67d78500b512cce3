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
import java.util.StringJoiner;

import javax.annotation.concurrent.Immutable;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

/**
 * Builds the request paths of the Data API for one database.
 *
 * @author Jeff Nelson
 */
@Immutable
final class ApiPath {

    private static final Escaper SEGMENT = UrlEscapers
            .urlPathSegmentEscaper();

    private static final Escaper PARAMETER = UrlEscapers
            .urlFormParameterEscaper();

    /**
     * Return {@code path} followed by a query string with the
     * {@code params}, if there are any.
     *
     * @param path
     * @param params
     * @return the path with the query string
     */
    static String withQuery(String path, Map<String, String> params) {
        if(params.isEmpty()) {
            return path;
        }
        StringJoiner query = new StringJoiner("&", path + "?", "");
        params.forEach((key, value) -> query
                .add(PARAMETER.escape(key) + "=" + PARAMETER.escape(value)));
        return query.toString();
    }

    /**
     * {@code /fmi/data/{version}}
     */
    private final String root;

    /**
     * {@code /fmi/data/{version}/databases/{database}}
     */
    private final String database;

    /**
     * Construct a new instance.
     *
     * @param version
     * @param database
     */
    ApiPath(String version, String database) {
        this.root = "/fmi/data/" + SEGMENT.escape(version);
        this.database = root + "/databases/" + SEGMENT.escape(database);
    }

    String container(String layout, String recordId, String field,
            int repetition) {
        return record(layout, recordId) + "/containers/"
                + SEGMENT.escape(field) + "/" + repetition;
    }

    String databases() {
        return root + "/databases";
    }

    String find(String layout) {
        return layout(layout) + "/_find";
    }

    String globals() {
        return database + "/globals";
    }

    String layout(String layout) {
        return layouts() + "/" + SEGMENT.escape(layout);
    }

    String layouts() {
        return database + "/layouts";
    }

    String productInfo() {
        return root + "/productInfo";
    }

    String record(String layout, String recordId) {
        return records(layout) + "/" + SEGMENT.escape(recordId);
    }

    String records(String layout) {
        return layout(layout) + "/records";
    }

    String script(String layout, String script) {
        return layout(layout) + "/script/" + SEGMENT.escape(script);
    }

    String scripts() {
        return database + "/scripts";
    }

    String session(String token) {
        return sessions() + "/" + SEGMENT.escape(token);
    }

    String sessions() {
        return database + "/sessions";
    }

}
