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

import java.math.BigDecimal;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import com.cinchapi.fmdata.result.JsonValues;
import com.cinchapi.fmdata.session.UsernamePasswordLogin;
import com.cinchapi.fmdata.transport.Transport;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.io.BaseEncoding;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * An in-memory stand-in for a Data API service that hosts one database.
 * <p>
 * It keeps records and portal rows per layout, issues tokens, answers
 * record, find, write, script and metadata calls, and lets tests reject
 * tokens, mutate the data between page requests and count the requests it
 * received.
 * </p>
 *
 * @author Jeff Nelson
 */
public final class FakeFileMakerServer implements Transport {

    public static final String DATABASE = "Contacts";
    public static final String USERNAME = "admin";
    public static final String PASSWORD = "secret";
    public static final String FMID_TOKEN = "fmid-token";

    private static final String PREFIX = "/fmi/data/v1";

    private final Map<String, List<FakeRecord>> layouts = Maps
            .newLinkedHashMap();

    /**
     * Layout to portal name to table occurrence.
     */
    private final Map<String, Map<String, String>> portals = Maps
            .newHashMap();

    private final Set<String> tokens = Sets.newHashSet();
    private final List<String> requests = Lists.newArrayList();
    private final Map<String, Object> globals = Maps.newLinkedHashMap();

    /**
     * Container field to the bytes last uploaded into it.
     */
    private final Map<String, byte[]> uploads = Maps.newHashMap();

    private int nextId = 1;
    private int nextToken = 1;
    private int logins = 0;
    private int pages = 0;
    private int rejections = 0;

    @Nullable
    private JsonObject lastBody = null;

    @Nullable
    private IntConsumer onPage = null;

    /**
     * Declare a layout.
     *
     * @param layout
     * @return this
     */
    public synchronized FakeFileMakerServer layout(String layout) {
        layouts.putIfAbsent(layout, Lists.newArrayList());
        portals.putIfAbsent(layout, Maps.newLinkedHashMap());
        return this;
    }

    /**
     * Declare a portal on {@code layout}.
     *
     * @param layout
     * @param portal
     * @param tableOccurrence
     * @return this
     */
    public synchronized FakeFileMakerServer portal(String layout,
            String portal, String tableOccurrence) {
        layout(layout);
        portals.get(layout).put(portal, tableOccurrence);
        return this;
    }

    /**
     * Append a record to {@code layout}.
     *
     * @param layout
     * @param fields remote field name to value
     * @return the record id
     */
    public synchronized String insert(String layout,
            Map<String, Object> fields) {
        return insertAt(layout, layouts.get(layout).size(), fields);
    }

    /**
     * Insert a record at {@code index} of the default order of
     * {@code layout}.
     *
     * @param layout
     * @param index
     * @param fields remote field name to value
     * @return the record id
     */
    public synchronized String insertAt(String layout, int index,
            Map<String, Object> fields) {
        FakeRecord record = new FakeRecord(String.valueOf(nextId++));
        fields.forEach((key, value) -> record.fields.put(key, normalize(value)));
        for (String portal : portals.get(layout).keySet()) {
            record.portals.put(portal, Lists.newArrayList());
        }
        layouts.get(layout).add(index, record);
        return record.id;
    }

    /**
     * Add a row to a portal of a record.
     *
     * @param layout
     * @param recordId
     * @param portal
     * @param fields remote field name, without the table occurrence, to value
     * @return the row id
     */
    public synchronized String addPortalRow(String layout, String recordId,
            String portal, Map<String, Object> fields) {
        String table = portals.get(layout).get(portal);
        FakeRecord row = new FakeRecord(String.valueOf(nextId++));
        fields.forEach((key, value) -> row.fields.put(table + "::" + key,
                normalize(value)));
        find(layout, recordId).portals.get(portal).add(row);
        return row.id;
    }

    /**
     * Remove a record directly.
     *
     * @param layout
     * @param recordId
     */
    public synchronized void remove(String layout, String recordId) {
        layouts.get(layout).removeIf(record -> record.id.equals(recordId));
    }

    /**
     * Return the stored fields of a record or {@code null} if it does not
     * exist.
     *
     * @param layout
     * @param recordId
     * @return the fields
     */
    @Nullable
    public synchronized Map<String, Object> fields(String layout,
            String recordId) {
        FakeRecord record = find(layout, recordId);
        return record == null ? null : Collections.unmodifiableMap(record.fields);
    }

    /**
     * Return the stored rows of a portal of a record.
     *
     * @param layout
     * @param recordId
     * @param portal
     * @return the rows, each keyed by {@code table::field}
     */
    public synchronized List<Map<String, Object>> portalRows(String layout,
            String recordId, String portal) {
        return find(layout, recordId).portals.get(portal).stream()
                .map(row -> row.fields).collect(Collectors.toList());
    }

    public synchronized Map<String, Object> globals() {
        return Collections.unmodifiableMap(Maps.newLinkedHashMap(globals));
    }

    /**
     * Forget every issued token, as a service restart would.
     */
    public synchronized void invalidateTokens() {
        tokens.clear();
    }

    /**
     * Reject the next {@code count} authenticated requests with an invalid
     * token error, forgetting the token each time.
     *
     * @param count
     */
    public synchronized void rejectNextCalls(int count) {
        rejections = count;
    }

    /**
     * Run {@code hook} after each records or find request with the number of
     * such requests so far.
     *
     * @param hook
     */
    public synchronized void onPage(IntConsumer hook) {
        this.onPage = hook;
    }

    public synchronized int logins() {
        return logins;
    }

    public synchronized int pages() {
        return pages;
    }

    @Nullable
    public synchronized JsonObject lastBody() {
        return lastBody;
    }

    /**
     * Return the number of received requests whose method is {@code method}
     * and whose path contains {@code fragment}.
     *
     * @param method
     * @param fragment
     * @return the count
     */
    public synchronized int count(String method, String fragment) {
        return (int) requests.stream()
                .filter(request -> request.startsWith(method + " ")
                        && request.contains(fragment))
                .count();
    }

    public synchronized List<String> requests() {
        return ImmutableList.copyOf(requests);
    }

    /**
     * Return a client for this server that logs in with the default
     * credentials and has no login cool-down.
     *
     * @return the client
     */
    public FileMakerClient client() {
        return FileMakerClient.builder().database(DATABASE).transport(this)
                .login(new UsernamePasswordLogin(USERNAME, PASSWORD))
                .loginCoolDown(null).build();
    }

    @Override
    public synchronized JsonObject send(String method, String path,
            Map<String, String> headers, @Nullable JsonObject body) {
        requests.add(method + " " + path);
        lastBody = body;
        String query = "";
        int question = path.indexOf('?');
        if(question >= 0) {
            query = path.substring(question + 1);
            path = path.substring(0, question);
        }
        Map<String, String> params = parse(query);
        List<String> segments = Lists.newArrayList();
        for (String segment : Splitter.on('/').omitEmptyStrings()
                .split(path.substring(PREFIX.length()))) {
            segments.add(URLDecoder.decode(segment, StandardCharsets.UTF_8));
        }
        if(segments.get(0).equals("productInfo")) {
            JsonObject info = new JsonObject();
            info.addProperty("name", "FileMaker Data API Engine");
            info.addProperty("version", "19.6");
            JsonObject response = new JsonObject();
            response.add("productInfo", info);
            return ok(response);
        }
        else if(segments.size() == 1) {
            JsonObject database = new JsonObject();
            database.addProperty("name", DATABASE);
            JsonArray databases = new JsonArray();
            databases.add(database);
            JsonObject response = new JsonObject();
            response.add("databases", databases);
            return ok(response);
        }
        else if(!segments.get(1).equals(DATABASE)) {
            return error(802, "Unable to open file");
        }
        else if(segments.get(2).equals("sessions")) {
            return segments.size() == 3 ? login(headers)
                    : logout(segments.get(3));
        }
        JsonObject rejected = authenticate(headers);
        if(rejected != null) {
            return rejected;
        }
        else if(segments.get(2).equals("globals")) {
            JsonObject fields = body.getAsJsonObject("globalFields");
            fields.entrySet().forEach(entry -> globals.put(entry.getKey(),
                    JsonValues.toJava(entry.getValue())));
            return ok(new JsonObject());
        }
        else if(segments.get(2).equals("scripts")) {
            JsonArray scripts = new JsonArray();
            JsonObject script = new JsonObject();
            script.addProperty("name", "Cleanup");
            script.addProperty("isFolder", false);
            scripts.add(script);
            JsonObject response = new JsonObject();
            response.add("scripts", scripts);
            return ok(response);
        }
        else if(segments.size() == 3) {
            JsonArray names = new JsonArray();
            for (String layout : layouts.keySet()) {
                JsonObject entry = new JsonObject();
                entry.addProperty("name", layout);
                names.add(entry);
            }
            JsonObject response = new JsonObject();
            response.add("layouts", names);
            return ok(response);
        }
        String layout = segments.get(3);
        if(!layouts.containsKey(layout)) {
            return error(105, "Layout is missing");
        }
        else if(segments.size() == 4) {
            JsonObject response = new JsonObject();
            response.add("portalMetaData", new JsonObject());
            response.add("fieldMetaData", new JsonArray());
            return ok(response);
        }
        String action = segments.get(4);
        if(action.equals("script")) {
            JsonObject response = new JsonObject();
            response.addProperty("scriptResult", params.get("script.param"));
            response.addProperty("scriptError", "0");
            return ok(response);
        }
        else if(action.equals("_find")) {
            return page(layout, body, true);
        }
        else if(segments.size() == 5 && method.equals("GET")) {
            JsonObject request = new JsonObject();
            params.forEach(request::addProperty);
            return page(layout, request, false);
        }
        else if(segments.size() == 5 && method.equals("POST")) {
            return create(layout, body);
        }
        String recordId = segments.get(5);
        FakeRecord record = find(layout, recordId);
        if(record == null) {
            return error(101, "Record is missing");
        }
        switch (method) {
        case "GET":
            JsonObject request = new JsonObject();
            params.forEach(request::addProperty);
            return records(layout, ImmutableList.of(record), request, false,
                    1);
        case "PATCH":
            return edit(layout, record, body);
        case "DELETE":
            layouts.get(layout).remove(record);
            return ok(new JsonObject());
        case "POST":
            FakeRecord copy = new FakeRecord(String.valueOf(nextId++));
            copy.fields.putAll(record.fields);
            record.portals.keySet()
                    .forEach(portal -> copy.portals.put(portal,
                            Lists.newArrayList()));
            layouts.get(layout).add(copy);
            return written(copy);
        default:
            return error(1630, "URL is invalid");
        }
    }

    @Override
    public synchronized JsonObject upload(String path,
            Map<String, String> headers, String filename, byte[] content) {
        requests.add("UPLOAD " + path);
        lastBody = null;
        List<String> segments = Lists.newArrayList();
        for (String segment : Splitter.on('/').omitEmptyStrings()
                .split(path.substring(PREFIX.length()))) {
            segments.add(URLDecoder.decode(segment, StandardCharsets.UTF_8));
        }
        JsonObject rejected = authenticate(headers);
        if(rejected != null) {
            return rejected;
        }
        // databases/{db}/layouts/{layout}/records/{id}/containers/{field}/{n}
        String layout = segments.get(3);
        if(!layouts.containsKey(layout)) {
            return error(105, "Layout is missing");
        }
        FakeRecord record = find(layout, segments.get(5));
        if(record == null) {
            return error(101, "Record is missing");
        }
        String field = segments.get(7);
        int repetition = Integer.parseInt(segments.get(8));
        String key = repetition == 1 ? field : field + "[" + repetition + "]";
        if(!record.fields.containsKey(key)) {
            return error(102, "Field is missing");
        }
        record.fields.put(key, "https://fms.test/Streaming/" + filename);
        uploads.put(key, content);
        ++record.modId;
        JsonObject response = new JsonObject();
        response.addProperty("modId", String.valueOf(record.modId));
        return ok(response);
    }

    /**
     * Return the bytes last uploaded into the container {@code field},
     * including any repetition suffix, or {@code null}.
     *
     * @param field
     * @return the content
     */
    @Nullable
    public synchronized byte[] uploaded(String field) {
        return uploads.get(field);
    }

    /**
     * Return an error reply if the bearer token of the {@code headers} is
     * not valid, or {@code null} if it is.
     *
     * @param headers
     * @return the error reply or {@code null}
     */
    @Nullable
    private JsonObject authenticate(Map<String, String> headers) {
        String authorization = headers.getOrDefault("Authorization", "");
        String token = authorization.startsWith("Bearer ")
                ? authorization.substring(7)
                : "";
        if(rejections > 0) {
            --rejections;
            tokens.remove(token);
            return error(952, "Invalid FileMaker Data API token (*)");
        }
        else if(!tokens.contains(token)) {
            return error(952, "Invalid FileMaker Data API token (*)");
        }
        else {
            return null;
        }
    }

    /**
     * Return the record {@code recordId} of {@code layout} or {@code null}.
     *
     * @param layout
     * @param recordId
     * @return the record
     */
    @Nullable
    private FakeRecord find(String layout, String recordId) {
        return layouts.get(layout).stream()
                .filter(record -> record.id.equals(recordId)).findFirst()
                .orElse(null);
    }

    private JsonObject login(Map<String, String> headers) {
        String authorization = headers.getOrDefault("Authorization", "");
        boolean valid;
        if(authorization.startsWith("Basic ")) {
            String credentials = new String(BaseEncoding.base64()
                    .decode(authorization.substring(6)),
                    StandardCharsets.UTF_8);
            valid = credentials.equals(USERNAME + ":" + PASSWORD);
        }
        else if(authorization.startsWith("FMID ")) {
            valid = authorization.substring(5).equals(FMID_TOKEN);
        }
        else {
            valid = headers.containsKey("X-FM-Data-OAuth-Request-Id")
                    && headers.containsKey("X-FM-Data-OAuth-Identifier");
        }
        ++logins;
        if(!valid) {
            return error(212, "Invalid user account and/or password");
        }
        String token = "token-" + nextToken++;
        tokens.add(token);
        JsonObject response = new JsonObject();
        response.addProperty("token", token);
        return ok(response);
    }

    private JsonObject logout(String token) {
        tokens.remove(token);
        return ok(new JsonObject());
    }

    private JsonObject create(String layout, JsonObject body) {
        FakeRecord record = new FakeRecord(String.valueOf(nextId++));
        body.getAsJsonObject("fieldData").entrySet()
                .forEach(entry -> record.fields.put(entry.getKey(),
                        JsonValues.toJava(entry.getValue())));
        for (String portal : portals.get(layout).keySet()) {
            record.portals.put(portal, Lists.newArrayList());
        }
        layouts.get(layout).add(record);
        return written(record);
    }

    private JsonObject edit(String layout, FakeRecord record,
            JsonObject body) {
        if(body.has("modId") && !body.get("modId").getAsString()
                .equals(String.valueOf(record.modId))) {
            return error(306, "Record modification id does not match");
        }
        for (Map.Entry<String, JsonElement> entry : body
                .getAsJsonObject("fieldData").entrySet()) {
            if(entry.getKey().equals("deleteRelated")) {
                JsonElement targets = entry.getValue();
                List<String> deletions = Lists.newArrayList();
                if(targets.isJsonArray()) {
                    targets.getAsJsonArray()
                            .forEach(target -> deletions.add(target.getAsString()));
                }
                else {
                    deletions.add(targets.getAsString());
                }
                for (String deletion : deletions) {
                    int dot = deletion.lastIndexOf('.');
                    String table = deletion.substring(0, dot);
                    String rowId = deletion.substring(dot + 1);
                    portals.get(layout).forEach((portal, occurrence) -> {
                        if(occurrence.equals(table)) {
                            record.portals.get(portal)
                                    .removeIf(row -> row.id.equals(rowId));
                        }
                    });
                }
            }
            else {
                record.fields.put(entry.getKey(),
                        JsonValues.toJava(entry.getValue()));
            }
        }
        if(body.has("portalData")) {
            for (Map.Entry<String, JsonElement> entry : body
                    .getAsJsonObject("portalData").entrySet()) {
                List<FakeRecord> rows = record.portals.get(entry.getKey());
                for (JsonElement change : entry.getValue().getAsJsonArray()) {
                    JsonObject values = change.getAsJsonObject();
                    String rowId = values.get("recordId").getAsString();
                    for (FakeRecord row : rows) {
                        if(row.id.equals(rowId)) {
                            values.entrySet().stream()
                                    .filter(value -> !value.getKey()
                                            .equals("recordId"))
                                    .forEach(value -> row.fields.put(
                                            value.getKey(), JsonValues
                                                    .toJava(value.getValue())));
                            ++row.modId;
                        }
                    }
                }
            }
        }
        ++record.modId;
        JsonObject response = new JsonObject();
        response.addProperty("modId", String.valueOf(record.modId));
        return ok(response);
    }

    /**
     * Answer a records or find request.
     *
     * @param layout
     * @param request the query parameters or the find body
     * @param find
     * @return the reply
     */
    private JsonObject page(String layout, JsonObject request, boolean find) {
        List<FakeRecord> found = Lists.newArrayList(layouts.get(layout));
        if(find) {
            List<JsonObject> clauses = Lists.newArrayList();
            request.getAsJsonArray("query")
                    .forEach(clause -> clauses.add(clause.getAsJsonObject()));
            found = found.stream().filter(record -> matches(record, clauses))
                    .collect(Collectors.toList());
        }
        JsonElement sort = request.get(find ? "sort" : "_sort");
        if(sort != null) {
            JsonArray keys = sort.isJsonArray() ? sort.getAsJsonArray()
                    : JsonParser.parseString(sort.getAsString())
                            .getAsJsonArray();
            Comparator<FakeRecord> order = null;
            for (JsonElement key : keys) {
                String field = key.getAsJsonObject().get("fieldName")
                        .getAsString();
                boolean descend = key.getAsJsonObject().get("sortOrder")
                        .getAsString().equals("descend");
                Comparator<FakeRecord> next = (a, b) -> compare(
                        a.fields.get(field), b.fields.get(field));
                if(descend) {
                    next = next.reversed();
                }
                order = order == null ? next : order.thenComparing(next);
            }
            if(order != null) {
                found.sort(order);
            }
        }
        int offset = integer(request, find ? "offset" : "_offset", 1);
        int limit = integer(request, find ? "limit" : "_limit", 100);
        int total = found.size();
        List<FakeRecord> window = found.subList(Math.min(offset - 1, total),
                Math.min(offset - 1 + limit, total));
        ++pages;
        JsonObject reply = window.isEmpty()
                ? error(401, "No records match the request")
                : records(layout, window, request, find, total);
        if(onPage != null) {
            onPage.accept(pages);
        }
        return reply;
    }

    /**
     * Return a reply that carries the {@code records}.
     */
    private JsonObject records(String layout, List<FakeRecord> records,
            JsonObject request, boolean find, int found) {
        Set<String> requested = null;
        if(request.has("portal")) {
            JsonElement names = request.get("portal");
            JsonArray array = names.isJsonArray() ? names.getAsJsonArray()
                    : JsonParser.parseString(names.getAsString())
                            .getAsJsonArray();
            requested = Sets.newLinkedHashSet();
            for (JsonElement name : array) {
                requested.add(name.getAsString());
            }
        }
        JsonArray data = new JsonArray();
        for (FakeRecord record : records) {
            JsonObject entry = new JsonObject();
            entry.add("fieldData", JsonValues.toJson(record.fields));
            JsonObject portalData = new JsonObject();
            for (Map.Entry<String, List<FakeRecord>> portal : record.portals
                    .entrySet()) {
                String name = portal.getKey();
                if(requested != null && !requested.contains(name)) {
                    continue;
                }
                int offset = integer(request,
                        (find ? "offset." : "_offset.") + name, 1);
                int limit = integer(request,
                        (find ? "limit." : "_limit.") + name, 50);
                List<FakeRecord> rows = portal.getValue();
                JsonArray array = new JsonArray();
                for (FakeRecord row : rows.subList(
                        Math.min(offset - 1, rows.size()),
                        Math.min(offset - 1 + limit, rows.size()))) {
                    JsonObject json = JsonValues.toJson(row.fields)
                            .getAsJsonObject();
                    json.addProperty("recordId", row.id);
                    json.addProperty("modId", String.valueOf(row.modId));
                    array.add(json);
                }
                portalData.add(name, array);
            }
            entry.add("portalData", portalData);
            entry.addProperty("recordId", record.id);
            entry.addProperty("modId", String.valueOf(record.modId));
            data.add(entry);
        }
        JsonObject info = new JsonObject();
        info.addProperty("database", DATABASE);
        info.addProperty("layout", layout);
        info.addProperty("table", layout);
        info.addProperty("totalRecordCount", layouts.get(layout).size());
        info.addProperty("foundCount", found);
        info.addProperty("returnedCount", records.size());
        JsonObject response = new JsonObject();
        response.add("dataInfo", info);
        response.add("data", data);
        return ok(response);
    }

    private JsonObject written(FakeRecord record) {
        JsonObject response = new JsonObject();
        response.addProperty("recordId", record.id);
        response.addProperty("modId", String.valueOf(record.modId));
        return ok(response);
    }

    /**
     * Return {@code true} if {@code record} is found by the {@code clauses}:
     * it meets some find clause and no later omit clause.
     */
    private static boolean matches(FakeRecord record,
            List<JsonObject> clauses) {
        boolean found = false;
        for (JsonObject clause : clauses) {
            boolean omit = clause.has("omit")
                    && clause.get("omit").getAsString().equals("true");
            boolean meets = true;
            for (Map.Entry<String, JsonElement> condition : clause
                    .entrySet()) {
                if(!condition.getKey().equals("omit")) {
                    meets &= meets(record.fields.get(condition.getKey()),
                            condition.getValue().getAsString());
                }
            }
            if(meets) {
                found = !omit;
            }
        }
        return found;
    }

    /**
     * Return {@code true} if {@code value} meets the find {@code expression}.
     */
    private static boolean meets(@Nullable Object value, String expression) {
        String text = value == null ? "" : text(value);
        if(expression.equals("==") || expression.equals("=")) {
            return text.isEmpty();
        }
        else if(expression.equals("*")) {
            return !text.isEmpty();
        }
        else if(expression.startsWith("==")) {
            String pattern = expression.substring(2);
            boolean leading = pattern.startsWith("*");
            boolean trailing = pattern.endsWith("*")
                    && !pattern.endsWith("\\*");
            String core = unescape(pattern.substring(leading ? 1 : 0,
                    pattern.length() - (trailing ? 1 : 0)));
            if(leading && trailing) {
                return text.contains(core);
            }
            else if(leading) {
                return text.endsWith(core);
            }
            else if(trailing) {
                return text.startsWith(core);
            }
            else {
                return text.equals(core);
            }
        }
        else if(expression.startsWith(">=")) {
            return compare(value, unescape(expression.substring(2))) >= 0;
        }
        else if(expression.startsWith("<=")) {
            return compare(value, unescape(expression.substring(2))) <= 0;
        }
        else if(expression.startsWith(">")) {
            return compare(value, unescape(expression.substring(1))) > 0;
        }
        else if(expression.startsWith("<")) {
            return compare(value, unescape(expression.substring(1))) < 0;
        }
        else if(expression.contains("...")) {
            int index = expression.indexOf("...");
            return compare(value, unescape(expression.substring(0, index))) >= 0
                    && compare(value,
                            unescape(expression.substring(index + 3))) <= 0;
        }
        else {
            return text.equals(unescape(expression));
        }
    }

    private static String unescape(String text) {
        return text.replaceAll("\\\\(.)", "$1");
    }

    private static String text(Object value) {
        return value instanceof BigDecimal
                ? ((BigDecimal) value).stripTrailingZeros().toPlainString()
                : value.toString();
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static int compare(@Nullable Object a, @Nullable Object b) {
        if(a == null || b == null) {
            return a == b ? 0 : a == null ? -1 : 1;
        }
        try {
            return new BigDecimal(text(a)).compareTo(new BigDecimal(text(b)));
        }
        catch (NumberFormatException e) {
            return text(a).compareTo(text(b));
        }
    }

    private static int integer(JsonObject request, String key,
            int defaultValue) {
        JsonElement value = request.get(key);
        return value == null ? defaultValue
                : Integer.parseInt(value.getAsString());
    }

    private static Object normalize(Object value) {
        return value instanceof Number ? new BigDecimal(value.toString())
                : value;
    }

    private static Map<String, String> parse(String query) {
        Map<String, String> params = Maps.newLinkedHashMap();
        if(!query.isEmpty()) {
            for (String pair : Splitter.on('&').split(query)) {
                Iterator<String> parts = Splitter.on('=').limit(2).split(pair)
                        .iterator();
                String key = URLDecoder.decode(parts.next(),
                        StandardCharsets.UTF_8);
                String value = parts.hasNext() ? URLDecoder
                        .decode(parts.next(), StandardCharsets.UTF_8) : "";
                params.put(key, value);
            }
        }
        return params;
    }

    private static JsonObject ok(JsonObject response) {
        JsonObject reply = new JsonObject();
        reply.add("response", response);
        reply.add("messages", messages(0, "OK"));
        return reply;
    }

    private static JsonObject error(int code, String message) {
        JsonObject reply = new JsonObject();
        reply.add("response", new JsonObject());
        reply.add("messages", messages(code, message));
        return reply;
    }

    private static JsonArray messages(int code, String message) {
        JsonObject entry = new JsonObject();
        entry.addProperty("code", String.valueOf(code));
        entry.addProperty("message", message);
        JsonArray messages = new JsonArray();
        messages.add(entry);
        return messages;
    }

    /**
     * A stored record or portal row.
     */
    private static final class FakeRecord {

        private final String id;
        private int modId = 0;
        private final Map<String, Object> fields = Maps.newLinkedHashMap();
        private final Map<String, List<FakeRecord>> portals = Maps
                .newLinkedHashMap();

        private FakeRecord(String id) {
            this.id = id;
        }

    }

}
