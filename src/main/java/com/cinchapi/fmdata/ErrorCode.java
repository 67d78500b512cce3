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

/**
 * Well known error codes that the Data API reports in the {@code messages}
 * section of a response.
 *
 * @author Jeff Nelson
 */
public enum ErrorCode {
    NO_ERROR(0),
    INSUFFICIENT_PRIVILEGES(9),
    RECORD_MISSING(101),
    FIELD_MISSING(102),
    LAYOUT_MISSING(105),
    INVALID_ACCOUNT(212),
    RECORD_IN_USE(301),
    MOD_ID_MISMATCH(306),
    NO_RECORDS_MATCH(401),
    FIELD_VALIDATION_FAILED(500),
    FILE_UNAVAILABLE(802),
    INVALID_DATA_API_TOKEN(952),
    MAXIMUM_CALLS_EXCEEDED(953);

    /**
     * The numeric code.
     */
    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    /**
     * Return the numeric code.
     *
     * @return the code
     */
    public int code() {
        return code;
    }

}
