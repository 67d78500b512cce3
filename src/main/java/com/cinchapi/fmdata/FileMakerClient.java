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

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cinchapi.fmdata.model.Model;
import com.cinchapi.fmdata.query.PortalRequest;
import com.cinchapi.fmdata.query.QueryBuilder;
import com.cinchapi.fmdata.query.Scripts;
import com.cinchapi.fmdata.query.SearchClause;
import com.cinchapi.fmdata.query.SortKey;
import com.cinchapi.fmdata.result.JsonValues;
import com.cinchapi.fmdata.result.LoginResult;
import com.cinchapi.fmdata.result.RecordsResult;
import com.cinchapi.fmdata.result.Result;
import com.cinchapi.fmdata.result.ScriptResult;
import com.cinchapi.fmdata.result.WriteResult;
import com.cinchapi.fmdata.session.DataSourceProvider;
import com.cinchapi.fmdata.session.LoginProvider;
import com.cinchapi.fmdata.session.SessionController;
import com.cinchapi.fmdata.transport.HttpTransport;
import com.cinchapi.fmdata.transport.Transport;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.BaseEncoding;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * A client for one database of a FileMaker Data API service.
 * <p>
 * The raw calls mirror the remote endpoints and return typed {@link Result
 * results} that never throw for remote errors on their own. Calls that need
 * a session go through a {@link SessionController}: with automatic session
 * management (the default) the client logs in on demand and logs in again,
 * once, when the remote service rejects the token. Without it, those calls
 * fail with a {@link SessionException} unless {@link #login()} was called.
 * </p>
 * <p>
 * Record offsets passed to the raw calls are 1-based, as on the wire. The
 * {@link #query(Model) query} layer works with 0-based positions.
 * </p>
 *
 * @author Jeff Nelson
 */
@ThreadSafe
public final class FileMakerClient {

    private static final Logger log = LoggerFactory
            .getLogger(FileMakerClient.class);

    /**
     * Return a new {@link Builder}.
     *
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return the value of a Basic {@code Authorization} header.
     *
     * @param username
     * @param password
     * @return the header value
     */
    private static String basic(String username, String password) {
        return "Basic " + BaseEncoding.base64().encode(
                (username + ":" + password).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Return the json array of the login's data sources.
     *
     * @param dataSources
     * @return the json array
     */
    private static JsonObject loginBody(List<DataSourceProvider> dataSources) {
        JsonArray sources = new JsonArray();
        for (DataSourceProvider source : dataSources) {
            sources.add(JsonValues.toJson(source.provide()));
        }
        JsonObject body = new JsonObject();
        body.add("fmDataSource", sources);
        return body;
    }

    private final Transport transport;
    private final ApiPath paths;
    private final String database;
    private final LoginProvider login;
    private final boolean autoManageSession;
    private final SessionController session;

    /**
     * Construct a new instance.
     *
     * @param builder
     */
    private FileMakerClient(Builder builder) {
        this.transport = builder.transport != null ? builder.transport
                : new HttpTransport(builder.url, builder.connectTimeout,
                        builder.readTimeout);
        this.database = builder.database;
        this.paths = new ApiPath(builder.apiVersion, builder.database);
        this.login = builder.login;
        this.autoManageSession = builder.autoManageSession;
        this.session = new SessionController(() -> login.login(this),
                builder.loginCoolDown);
    }

    /**
     * Create a record in {@code layout}.
     *
     * @param layout
     * @param fieldData remote field name to remote value
     * @param portalData portal name to new rows, or {@code null}
     * @param scripts
     * @return the result, carrying the new record id and mod id
     */
    public WriteResult createRecord(String layout,
            Map<String, Object> fieldData,
            @Nullable Map<String, List<Map<String, Object>>> portalData,
            Scripts scripts) {
        JsonObject body = new JsonObject();
        body.add("fieldData", JsonValues.toJson(fieldData));
        if(portalData != null && !portalData.isEmpty()) {
            body.add("portalData", JsonValues.toJson(portalData));
        }
        addScripts(body, scripts);
        return managed(token -> new WriteResult(
                send("POST", paths.records(layout), token, body)));
    }

    /**
     * Return the name of the database this client talks to.
     *
     * @return the database
     */
    public String database() {
        return database;
    }

    /**
     * Delete the record {@code recordId}.
     *
     * @param layout
     * @param recordId
     * @param scripts
     * @return the result
     */
    public Result deleteRecord(String layout, String recordId,
            Scripts scripts) {
        String path = ApiPath.withQuery(paths.record(layout, recordId),
                scripts.toParameters());
        return managed(token -> new Result(send("DELETE", path, token, null)));
    }

    /**
     * Duplicate the record {@code recordId}.
     *
     * @param layout
     * @param recordId
     * @param scripts
     * @return the result, carrying the id of the copy
     */
    public WriteResult duplicateRecord(String layout, String recordId,
            Scripts scripts) {
        JsonObject body = new JsonObject();
        addScripts(body, scripts);
        return managed(token -> new WriteResult(send("POST",
                paths.record(layout, recordId), token, body)));
    }

    /**
     * Edit the record {@code recordId}.
     *
     * @param layout
     * @param recordId
     * @param fieldData remote field name to remote value
     * @param modId if not {@code null}, the edit fails unless the record
     *            still has this mod id
     * @param portalData portal name to changed rows, or {@code null}
     * @param deleteRelated the related rows to delete, each as
     *            {@code table.recordId}
     * @param scripts
     * @return the result, carrying the new mod id
     */
    public WriteResult editRecord(String layout, String recordId,
            Map<String, Object> fieldData, @Nullable String modId,
            @Nullable Map<String, List<Map<String, Object>>> portalData,
            List<String> deleteRelated, Scripts scripts) {
        JsonObject fields = JsonValues.toJson(fieldData).getAsJsonObject();
        if(!deleteRelated.isEmpty()) {
            fields.add("deleteRelated", JsonValues.toJson(deleteRelated));
        }
        JsonObject body = new JsonObject();
        body.add("fieldData", fields);
        if(modId != null) {
            body.addProperty("modId", modId);
        }
        if(portalData != null && !portalData.isEmpty()) {
            body.add("portalData", JsonValues.toJson(portalData));
        }
        addScripts(body, scripts);
        return managed(token -> new WriteResult(send("PATCH",
                paths.record(layout, recordId), token, body)));
    }

    /**
     * Find the records of {@code layout} that meet the {@code clauses}.
     * The clauses are applied in order; omit clauses remove records found
     * by earlier clauses.
     *
     * @param layout
     * @param clauses
     * @param sort
     * @param offset the 1-based position of the first record
     * @param limit
     * @param portals
     * @param scripts
     * @param responseLayout
     * @return the result
     */
    public RecordsResult find(String layout, List<SearchClause> clauses,
            List<SortKey> sort, int offset, int limit,
            List<PortalRequest> portals, Scripts scripts,
            @Nullable String responseLayout) {
        Preconditions.checkArgument(!clauses.isEmpty(),
                "A find needs at least one clause");
        JsonObject body = new JsonObject();
        JsonArray query = new JsonArray();
        clauses.forEach(clause -> query.add(clause.toJson()));
        body.add("query", query);
        if(!sort.isEmpty()) {
            JsonArray keys = new JsonArray();
            sort.forEach(key -> keys.add(key.toJson()));
            body.add("sort", keys);
        }
        body.addProperty("offset", String.valueOf(offset));
        body.addProperty("limit", String.valueOf(limit));
        if(!portals.isEmpty()) {
            JsonArray names = new JsonArray();
            for (PortalRequest portal : portals) {
                names.add(portal.name());
                body.addProperty("offset." + portal.name(),
                        String.valueOf(portal.offset() + 1));
                body.addProperty("limit." + portal.name(),
                        String.valueOf(portal.firstPageLimit()));
            }
            body.add("portal", names);
        }
        if(responseLayout != null) {
            body.addProperty("layout.response", responseLayout);
        }
        addScripts(body, scripts);
        return managed(token -> new RecordsResult(
                send("POST", paths.find(layout), token, body)));
    }

    /**
     * Return the databases the service hosts. No session is needed.
     *
     * @return the result
     */
    public Result getDatabases() {
        return new Result(transport.send("GET", paths.databases(),
                ImmutableMap.of(), null));
    }

    /**
     * Return the databases that {@code username} can access. No session is
     * needed.
     *
     * @param username
     * @param password
     * @return the result
     */
    public Result getDatabases(String username, String password) {
        return new Result(transport.send("GET", paths.databases(),
                ImmutableMap.of("Authorization", basic(username, password)),
                null));
    }

    /**
     * Return the metadata of {@code layout}.
     *
     * @param layout
     * @return the result
     */
    public Result getLayout(String layout) {
        return managed(token -> new Result(
                send("GET", paths.layout(layout), token, null)));
    }

    /**
     * Return the layouts of the database.
     *
     * @return the result
     */
    public Result getLayouts() {
        return managed(
                token -> new Result(send("GET", paths.layouts(), token, null)));
    }

    /**
     * Return information about the service. No session is needed.
     *
     * @return the result
     */
    public Result getProductInfo() {
        return new Result(transport.send("GET", paths.productInfo(),
                ImmutableMap.of(), null));
    }

    /**
     * Return the record {@code recordId} without portal rows.
     *
     * @param layout
     * @param recordId
     * @return the result
     */
    public RecordsResult getRecord(String layout, String recordId) {
        return getRecord(layout, recordId, ImmutableList.of(), Scripts.none(),
                null);
    }

    /**
     * Return the record {@code recordId}.
     *
     * @param layout
     * @param recordId
     * @param portals the portal rows to include
     * @param scripts
     * @param responseLayout
     * @return the result
     */
    public RecordsResult getRecord(String layout, String recordId,
            List<PortalRequest> portals, Scripts scripts,
            @Nullable String responseLayout) {
        Map<String, String> params = Maps.newLinkedHashMap();
        addPortals(params, portals);
        if(responseLayout != null) {
            params.put("layout.response", responseLayout);
        }
        params.putAll(scripts.toParameters());
        String path = ApiPath.withQuery(paths.record(layout, recordId),
                params);
        return managed(
                token -> new RecordsResult(send("GET", path, token, null)));
    }

    /**
     * Return a range of the records of {@code layout}.
     *
     * @param layout
     * @param offset the 1-based position of the first record
     * @param limit
     * @param sort
     * @param portals
     * @param scripts
     * @param responseLayout
     * @return the result
     */
    public RecordsResult getRecords(String layout, int offset, int limit,
            List<SortKey> sort, List<PortalRequest> portals, Scripts scripts,
            @Nullable String responseLayout) {
        Map<String, String> params = Maps.newLinkedHashMap();
        params.put("_offset", String.valueOf(offset));
        params.put("_limit", String.valueOf(limit));
        if(!sort.isEmpty()) {
            JsonArray keys = new JsonArray();
            sort.forEach(key -> keys.add(key.toJson()));
            params.put("_sort", keys.toString());
        }
        addPortals(params, portals);
        if(responseLayout != null) {
            params.put("layout.response", responseLayout);
        }
        params.putAll(scripts.toParameters());
        String path = ApiPath.withQuery(paths.records(layout), params);
        return managed(
                token -> new RecordsResult(send("GET", path, token, null)));
    }

    /**
     * Return the scripts of the database.
     *
     * @return the result
     */
    public Result getScripts() {
        return managed(
                token -> new Result(send("GET", paths.scripts(), token, null)));
    }

    /**
     * Return {@code true} if the client holds a session token believed to be
     * valid.
     *
     * @return a boolean
     */
    public boolean isLoggedIn() {
        return session.isActive();
    }

    /**
     * Make sure there is an active session. A login that would happen within
     * the configured cool-down of the previous attempt fails with a
     * {@link LoginRetriedTooFastException}.
     *
     * @throws SessionException if the login fails
     */
    public void login() {
        session.ensureLoggedIn();
    }

    /**
     * End the active session, if any.
     *
     * @return the result of the logout call or {@code null} if there was no
     *         active session
     */
    @Nullable
    public Result logout() {
        return session.logout(token -> new Result(transport.send("DELETE",
                paths.session(token), ImmutableMap.of(), null)));
    }

    /**
     * Run the script {@code name} in the context of {@code layout}.
     *
     * @param layout
     * @param name
     * @param param
     * @return the result
     */
    public ScriptResult performScript(String layout, String name,
            @Nullable String param) {
        String path = param == null ? paths.script(layout, name)
                : ApiPath.withQuery(paths.script(layout, name),
                        ImmutableMap.of("script.param", param));
        return managed(
                token -> new ScriptResult(send("GET", path, token, null)));
    }

    /**
     * Start a query over the records of {@code model}.
     *
     * @param model
     * @return the query
     */
    public QueryBuilder query(Model model) {
        return new QueryBuilder(this, model);
    }

    /**
     * Log in with a username and password, without touching the session
     * state. This is the call a {@link LoginProvider} makes.
     *
     * @param username
     * @param password
     * @param dataSources
     * @return the result
     */
    public LoginResult rawLoginUsernamePassword(String username,
            String password, List<DataSourceProvider> dataSources) {
        log.debug("Logging into {} as {}", database, username);
        return new LoginResult(transport.send("POST", paths.sessions(),
                ImmutableMap.of("Authorization", basic(username, password),
                        "Content-Type", "application/json"),
                loginBody(dataSources)));
    }

    /**
     * Complete an OAuth login, without touching the session state. This is
     * the call a {@link LoginProvider} makes.
     *
     * @param requestId
     * @param identifier
     * @param dataSources
     * @return the result
     */
    public LoginResult rawLoginOAuth(String requestId, String identifier,
            List<DataSourceProvider> dataSources) {
        log.debug("Logging into {} with OAuth", database);
        return new LoginResult(transport.send("POST", paths.sessions(),
                ImmutableMap.of("X-FM-Data-OAuth-Request-Id", requestId,
                        "X-FM-Data-OAuth-Identifier", identifier,
                        "Content-Type", "application/json"),
                loginBody(dataSources)));
    }

    /**
     * Complete a Claris Cloud login with an FMID token, without touching the
     * session state. This is the call a {@link LoginProvider} makes.
     *
     * @param fmidToken
     * @param dataSources
     * @return the result
     */
    public LoginResult rawLoginClarisCloud(String fmidToken,
            List<DataSourceProvider> dataSources) {
        log.debug("Logging into {} with a Claris ID", database);
        return new LoginResult(transport.send("POST", paths.sessions(),
                ImmutableMap.of("Authorization", "FMID " + fmidToken,
                        "Content-Type", "application/json"),
                loginBody(dataSources)));
    }

    /**
     * Set the values of global fields for the session.
     *
     * @param fields fully qualified global field name to value
     * @return the result
     */
    public Result setGlobals(Map<String, Object> fields) {
        JsonObject body = new JsonObject();
        body.add("globalFields", JsonValues.toJson(fields));
        return managed(token -> new Result(
                send("PATCH", paths.globals(), token, body)));
    }

    /**
     * Upload {@code content} into the first repetition of the container
     * {@code field} of a record.
     *
     * @param layout
     * @param recordId
     * @param field the remote field name
     * @param filename
     * @param content
     * @return the result, carrying the new mod id
     */
    public WriteResult uploadContainer(String layout, String recordId,
            String field, String filename, byte[] content) {
        return uploadContainer(layout, recordId, field, 1, filename, content);
    }

    /**
     * Upload {@code content} into the {@code repetition} of the container
     * {@code field} of a record. The remote service stores the file and
     * replaces whatever the container held.
     *
     * @param layout
     * @param recordId
     * @param field the remote field name, without a repetition suffix
     * @param repetition the 1-based repetition
     * @param filename
     * @param content
     * @return the result, carrying the new mod id
     */
    public WriteResult uploadContainer(String layout, String recordId,
            String field, int repetition, String filename, byte[] content) {
        Preconditions.checkArgument(repetition > 0,
                "Repetitions start at 1");
        String path = paths.container(layout, recordId, field, repetition);
        return managed(token -> new WriteResult(transport.upload(path,
                ImmutableMap.of("Authorization", "Bearer " + token),
                filename, content)));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("database", database)
                .add("session", session).toString();
    }

    /**
     * Return the {@link SessionController}.
     *
     * @return the session controller
     */
    SessionController session() {
        return session;
    }

    /**
     * Add the portal parameters of a records request.
     *
     * @param params
     * @param portals
     */
    private void addPortals(Map<String, String> params,
            List<PortalRequest> portals) {
        if(!portals.isEmpty()) {
            JsonArray names = new JsonArray();
            for (PortalRequest portal : portals) {
                names.add(portal.name());
                params.put("_offset." + portal.name(),
                        String.valueOf(portal.offset() + 1));
                params.put("_limit." + portal.name(),
                        String.valueOf(portal.firstPageLimit()));
            }
            params.put("portal", names.toString());
        }
    }

    /**
     * Add the script members of a request body.
     *
     * @param body
     * @param scripts
     */
    private void addScripts(JsonObject body, Scripts scripts) {
        scripts.toParameters().forEach(body::addProperty);
    }

    /**
     * Run {@code op} under the session policy of this client.
     *
     * @param op
     * @return the result
     */
    private <R extends Result> R managed(Function<String, R> op) {
        return autoManageSession ? session.callWithAutoRetry(op)
                : session.call(op);
    }

    /**
     * Send an authenticated request.
     *
     * @param method
     * @param path
     * @param token
     * @param body
     * @return the reply
     */
    private JsonObject send(String method, String path, String token,
            @Nullable JsonObject body) {
        Map<String, String> headers = body == null
                ? ImmutableMap.of("Authorization", "Bearer " + token)
                : ImmutableMap.of("Authorization", "Bearer " + token,
                        "Content-Type", "application/json");
        return transport.send(method, path, headers, body);
    }

    /**
     * Configures and builds a {@link FileMakerClient}.
     *
     * @author Jeff Nelson
     */
    public static class Builder {

        private String apiVersion = "v1";
        private boolean autoManageSession = true;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private String database;
        private LoginProvider login;
        private Duration loginCoolDown = Duration.ofSeconds(1);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Transport transport;
        private String url;

        /**
         * Set the Data API version used in request paths.
         *
         * @param apiVersion
         * @return this builder
         */
        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        /**
         * Set whether the client logs in on demand and retries once after an
         * invalid token.
         *
         * @param autoManageSession
         * @return this builder
         */
        public Builder autoManageSession(boolean autoManageSession) {
            this.autoManageSession = autoManageSession;
            return this;
        }

        /**
         * Build the configured {@link FileMakerClient} and return the
         * instance.
         *
         * @return a {@link FileMakerClient}
         */
        public FileMakerClient build() {
            Preconditions.checkState(database != null,
                    "A database is required");
            Preconditions.checkState(login != null,
                    "A login provider is required");
            Preconditions.checkState(url != null || transport != null,
                    "Either a url or a transport is required");
            return new FileMakerClient(this);
        }

        /**
         * Set the connect timeout of the default transport.
         *
         * @param connectTimeout
         * @return this builder
         */
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * Set the database.
         *
         * @param database
         * @return this builder
         */
        public Builder database(String database) {
            this.database = database;
            return this;
        }

        /**
         * Set how the client logs in.
         *
         * @param login
         * @return this builder
         */
        public Builder login(LoginProvider login) {
            this.login = login;
            return this;
        }

        /**
         * Set the minimum time between two explicit login attempts;
         * {@code null} or zero disables the check.
         *
         * @param loginCoolDown
         * @return this builder
         */
        public Builder loginCoolDown(@Nullable Duration loginCoolDown) {
            this.loginCoolDown = loginCoolDown;
            return this;
        }

        /**
         * Set the read timeout of the default transport.
         *
         * @param readTimeout
         * @return this builder
         */
        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        /**
         * Set the {@link Transport} to use instead of the default HTTP one.
         *
         * @param transport
         * @return this builder
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Set the base url of the service, e.g.
         * {@code https://fms.example.com}.
         *
         * @param url
         * @return this builder
         */
        public Builder url(String url) {
            this.url = url;
            return this;
        }

    }

}
