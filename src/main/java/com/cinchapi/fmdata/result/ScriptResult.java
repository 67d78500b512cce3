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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.gson.JsonObject;

/**
 * The result of a call that runs a script. Record reads also report the
 * outcome of the scripts that were attached to them, so {@link RecordsResult}
 * extends this class.
 *
 * @author Jeff Nelson
 */
@Immutable
public class ScriptResult extends Result {

    /**
     * Construct a new instance.
     *
     * @param raw
     */
    public ScriptResult(JsonObject raw) {
        super(raw);
    }

    /**
     * Return the result of the script that ran after the request.
     *
     * @return the script result
     */
    @Nullable
    public String scriptResult() {
        return JsonValues.getString(response(), "scriptResult");
    }

    /**
     * Return the error code of the script that ran after the request.
     *
     * @return the script error
     */
    @Nullable
    public String scriptError() {
        return JsonValues.getString(response(), "scriptError");
    }

    /**
     * Return the result of the pre-request script.
     *
     * @return the script result
     */
    @Nullable
    public String preRequestScriptResult() {
        return JsonValues.getString(response(), "scriptResult.prerequest");
    }

    /**
     * Return the error code of the pre-request script.
     *
     * @return the script error
     */
    @Nullable
    public String preRequestScriptError() {
        return JsonValues.getString(response(), "scriptError.prerequest");
    }

    /**
     * Return the result of the pre-sort script.
     *
     * @return the script result
     */
    @Nullable
    public String preSortScriptResult() {
        return JsonValues.getString(response(), "scriptResult.presort");
    }

    /**
     * Return the error code of the pre-sort script.
     *
     * @return the script error
     */
    @Nullable
    public String preSortScriptError() {
        return JsonValues.getString(response(), "scriptError.presort");
    }

}
