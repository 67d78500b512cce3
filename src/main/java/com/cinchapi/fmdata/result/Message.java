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

import java.util.Objects;

import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.ErrorCode;
import com.google.common.base.MoreObjects;

/**
 * One {@code (code, message)} entry from the {@code messages} section of a
 * response.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class Message {

    /**
     * Return a {@link Message}.
     *
     * @param code
     * @param message
     * @return the message
     */
    public static Message of(int code, String message) {
        return new Message(code, message);
    }

    /**
     * Return a {@link Message} for the {@code code}.
     *
     * @param code
     * @param message
     * @return the message
     */
    public static Message of(ErrorCode code, String message) {
        return new Message(code.code(), message);
    }

    private final int code;
    private final String message;

    /**
     * Construct a new instance.
     *
     * @param code
     * @param message
     */
    private Message(int code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Return the numeric code.
     *
     * @return the code
     */
    public int code() {
        return code;
    }

    /**
     * Return {@code true} if this entry has the {@code code}.
     *
     * @param code
     * @return a boolean
     */
    public boolean is(ErrorCode code) {
        return this.code == code.code();
    }

    /**
     * Return the human readable message.
     *
     * @return the message
     */
    public String message() {
        return message;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof Message) {
            return code == ((Message) obj).code
                    && Objects.equals(message, ((Message) obj).message);
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("code", code)
                .add("message", message).toString();
    }

}
