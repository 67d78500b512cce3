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
package com.cinchapi.fmdata.result;

import java.util.List;
import java.util.Optional;

import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.ErrorCode;
import com.cinchapi.fmdata.RemoteBusinessException;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * The decoded response of one Data API call.
 * <p>
 * Every response carries a {@code messages} list of {@code (code, message)}
 * entries and, usually, a {@code response} payload. A code of
 * {@link ErrorCode#NO_ERROR 0} means success; every other code is an error.
 * A {@link Result} never throws on its own: callers decide whether to
 * {@link #raiseIfError() raise} or inspect the {@link #errors()}.
 * </p>
 *
 * @author Jeff Nelson
 */
@Immutable
public class Result {

    /**
     * The raw json content.
     */
    protected final JsonObject raw;

    /**
     * The parsed {@link #messages()}.
     */
    private final List<Message> messages;

    /**
     * Construct a new instance.
     *
     * @param raw
     */
    public Result(JsonObject raw) {
        this.raw = raw;
        ImmutableList.Builder<Message> messages = ImmutableList.builder();
        JsonElement entries = raw.get("messages");
        if(entries != null && entries.isJsonArray()) {
            for (JsonElement entry : entries.getAsJsonArray()) {
                JsonObject object = entry.getAsJsonObject();
                Integer code = JsonValues.getInteger(object, "code");
                String message = JsonValues.getString(object, "message");
                messages.add(Message.of(code == null ? 0 : code, message));
            }
        }
        this.messages = messages.build();
    }

    /**
     * Return the entries in the {@code messages} section whose code is not
     * {@link ErrorCode#NO_ERROR}.
     *
     * @return the errors
     */
    public List<Message> errors() {
        return messages.stream()
                .filter(message -> !message.is(ErrorCode.NO_ERROR))
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Return the first error entry with the {@code code}, if any.
     *
     * @param code
     * @return the error entry
     */
    public Optional<Message> error(ErrorCode code) {
        return messages.stream().filter(message -> message.is(code))
                .findFirst();
    }

    /**
     * Return {@code true} if this result carries any error.
     *
     * @return a boolean
     */
    public boolean hasErrors() {
        return !errors().isEmpty();
    }

    /**
     * Return {@code true} if this result carries the error {@code code}.
     *
     * @param code
     * @return a boolean
     */
    public boolean hasError(ErrorCode code) {
        return error(code).isPresent();
    }

    /**
     * Return all the entries in the {@code messages} section.
     *
     * @return the messages
     */
    public List<Message> messages() {
        return messages;
    }

    /**
     * Throw a {@link RemoteBusinessException} for the first error in this
     * result, if any.
     *
     * @throws RemoteBusinessException
     */
    public void raiseIfError() {
        List<Message> errors = errors();
        if(!errors.isEmpty()) {
            throw new RemoteBusinessException(errors.get(0));
        }
    }

    /**
     * Return the raw json content.
     *
     * @return the raw content
     */
    public JsonObject raw() {
        return raw;
    }

    /**
     * Return the {@code response} payload, which is empty if the remote
     * service did not send one.
     *
     * @return the response
     */
    public JsonObject response() {
        JsonElement response = raw.get("response");
        return response != null && response.isJsonObject()
                ? response.getAsJsonObject()
                : new JsonObject();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("messages", messages)
                .toString();
    }

}
