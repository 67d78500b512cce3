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
package com.cinchapi.fmdata.query;

import java.util.Objects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;

/**
 * The name of a script to run as part of a request and its optional
 * parameter.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class ScriptRequest {

    /**
     * Return a {@link ScriptRequest}.
     *
     * @param name
     * @param param
     * @return the request
     */
    public static ScriptRequest of(String name, @Nullable String param) {
        return new ScriptRequest(name, param);
    }

    private final String name;

    @Nullable
    private final String param;

    private ScriptRequest(String name, @Nullable String param) {
        this.name = name;
        this.param = param;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof ScriptRequest) {
            return name.equals(((ScriptRequest) obj).name)
                    && Objects.equals(param, ((ScriptRequest) obj).param);
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, param);
    }

    public String name() {
        return name;
    }

    @Nullable
    public String param() {
        return param;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", name)
                .add("param", param).toString();
    }

}
